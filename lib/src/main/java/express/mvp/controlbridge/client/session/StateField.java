package express.mvp.controlbridge.client.session;

import java.util.Optional;

/** Remote controls mirrored in the state cache, with their wire and semantic names. */
public enum StateField {
    HARDWARE_STATE("HardwareState", "hardwareState"),
    CONNECTED_SOURCES("ConnectedSources", "connectedSources"),
    SCREEN_POWER("hdmi.enabled.button", "screenPower"),
    PRIVACY_GLASS("pin.8.digital.out", "privacyGlass"),
    DIDO_OUTPUT("hdmi.out.1.select.hdmi.1", "didoOutput"),
    LIGHTING_LEVEL("ZoneDimLevel1", "lightingLevel"),
    VOLUME_LEVEL("output.1.gain", "volumeLevel");

    private final String wireName;
    private final String semanticName;

    StateField(String wireName, String semanticName) {
        this.wireName = wireName;
        this.semanticName = semanticName;
    }

    public String wireName() {
        return wireName;
    }

    public String semanticName() {
        return semanticName;
    }

    /**
     * Looks up the field for a wire control name. Matching is exact.
     *
     * @param wireName control name as sent by the bridge
     * @return the field, or empty for controls that are not mirrored
     */
    public static Optional<StateField> fromWire(String wireName) {
        for (StateField field : values()) {
            if (field.wireName.equals(wireName)) {
                return Optional.of(field);
            }
        }
        return Optional.empty();
    }
}
