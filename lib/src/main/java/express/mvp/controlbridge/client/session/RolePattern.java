package express.mvp.controlbridge.client.session;

import java.util.List;
import java.util.Objects;

/**
 * Maps a role alias (for example {@code lighting}) to component name fragments.
 *
 * <p>A component fills a role when its display name contains any of the fragments. Matching is
 * case-sensitive.
 *
 * @param role role alias used by callers
 * @param nameFragments substrings to look for in component names
 */
public record RolePattern(String role, List<String> nameFragments) {

    public RolePattern {
        Objects.requireNonNull(role, "role");
        nameFragments = List.copyOf(nameFragments);
        if (nameFragments.isEmpty()) {
            throw new IllegalArgumentException("Role " + role + " needs at least one fragment");
        }
    }

    public static RolePattern of(String role, String... nameFragments) {
        return new RolePattern(role, List.of(nameFragments));
    }

    /**
     * Returns the roles of the standard room deployment.
     *
     * @return video wall, HDMI display, GPIO, HDMI decoder, lighting and mixer patterns
     */
    public static List<RolePattern> defaults() {
        return List.of(
                of("videoWall", "BUControl", "Video Wall"),
                of("hdmiDisplay", "Generic_HDMI_Display"),
                of("gpio", "GPIO_Out_Core-Maktabi"),
                of("hdmiDecoder", "HDMI_I/ODecoder"),
                of("lighting", "LutronLEAPZone"),
                of("mixer", "Mixer_8x8_2"));
    }

    boolean matches(String displayName) {
        for (String fragment : nameFragments) {
            if (displayName.contains(fragment)) {
                return true;
            }
        }
        return false;
    }
}
