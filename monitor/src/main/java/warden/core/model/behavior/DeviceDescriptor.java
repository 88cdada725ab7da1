package warden.core.model.behavior;

import java.util.Locale;

/**
 * Coarse device classification derived from a user agent.
 *
 * @param deviceType Mobile, Tablet or Desktop
 * @param browser    browser family
 * @param os         operating system family
 */
public record DeviceDescriptor(String deviceType, String browser, String os) {

    public static final DeviceDescriptor UNKNOWN =
            new DeviceDescriptor(BehaviorEvent.UNKNOWN, BehaviorEvent.UNKNOWN, BehaviorEvent.UNKNOWN);

    /**
     * Classify a user agent string.
     *
     * @param userAgent the header value, may be null
     * @return the descriptor, {@link #UNKNOWN} for a blank agent
     */
    public static DeviceDescriptor parse(String userAgent) {
        if (userAgent == null || userAgent.isBlank()) {
            return UNKNOWN;
        }
        final var ua = userAgent.toLowerCase(Locale.ROOT);
        return new DeviceDescriptor(deviceType(ua), browser(ua), os(ua));
    }

    /**
     * Stable identifier used as the device key in baselines and device trust.
     *
     * @return e.g. {@code Desktop_Chrome_Windows}
     */
    public String id() {
        return deviceType + "_" + browser + "_" + os;
    }

    private static String deviceType(String ua) {
        if (ua.contains("ipad") || ua.contains("tablet") || (ua.contains("android") && !ua.contains("mobile"))) {
            return "Tablet";
        }
        if (ua.contains("mobile") || ua.contains("iphone") || ua.contains("android")) {
            return "Mobile";
        }
        return "Desktop";
    }

    // Order matters: Edge and Opera agents also contain "chrome", Chrome agents contain "safari"
    private static String browser(String ua) {
        if (ua.contains("edg/") || ua.contains("edge/")) {
            return "Edge";
        }
        if (ua.contains("opr/") || ua.contains("opera")) {
            return "Opera";
        }
        if (ua.contains("firefox/")) {
            return "Firefox";
        }
        if (ua.contains("chrome/") || ua.contains("crios/")) {
            return "Chrome";
        }
        if (ua.contains("safari/")) {
            return "Safari";
        }
        return "Other";
    }

    private static String os(String ua) {
        if (ua.contains("windows")) {
            return "Windows";
        }
        if (ua.contains("iphone") || ua.contains("ipad") || ua.contains("ios")) {
            return "iOS";
        }
        if (ua.contains("mac os") || ua.contains("macintosh")) {
            return "macOS";
        }
        if (ua.contains("android")) {
            return "Android";
        }
        if (ua.contains("linux")) {
            return "Linux";
        }
        return "Other";
    }
}
