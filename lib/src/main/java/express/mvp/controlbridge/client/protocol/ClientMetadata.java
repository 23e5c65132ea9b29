package express.mvp.controlbridge.client.protocol;

import java.util.Objects;

/**
 * What the client tells the bridge about itself in {@code client:identify}.
 *
 * @param platform client platform tag
 * @param device device class ({@code server}, {@code cloud}, ...)
 * @param osVersion host operating system
 * @param appVersion client version
 * @param buildNumber build number
 * @param deviceName human-readable name shown in the bridge's client list
 */
public record ClientMetadata(
        String platform,
        String device,
        String osVersion,
        String appVersion,
        String buildNumber,
        String deviceName) {

    public ClientMetadata {
        Objects.requireNonNull(platform, "platform");
        Objects.requireNonNull(device, "device");
        Objects.requireNonNull(osVersion, "osVersion");
        Objects.requireNonNull(appVersion, "appVersion");
        Objects.requireNonNull(buildNumber, "buildNumber");
        Objects.requireNonNull(deviceName, "deviceName");
    }
}
