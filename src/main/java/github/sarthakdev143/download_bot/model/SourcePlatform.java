package github.sarthakdev143.download_bot.model;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.List;
import java.util.Locale;

public enum SourcePlatform {
    YOUTUBE("YouTube", List.of("youtube.com", "youtu.be")),
    INSTAGRAM("Instagram", List.of("instagram.com")),
    TIKTOK("TikTok", List.of("tiktok.com")),
    FACEBOOK("Facebook", List.of("facebook.com", "fb.watch")),
    TWITTER("Twitter/X", List.of("twitter.com", "x.com")),
    REDDIT("Reddit", List.of("reddit.com", "v.redd.it")),
    THREADS("Threads", List.of("threads.net")),
    PINTEREST("Pinterest", List.of("pinterest.com", "pin.it")),
    LINKEDIN("LinkedIn", List.of("linkedin.com")),
    TWITCH("Twitch", List.of("twitch.tv")),
    VIMEO("Vimeo", List.of("vimeo.com")),
    STREAMABLE("Streamable", List.of("streamable.com")),
    BILIBILI("Bilibili", List.of("bilibili.tv", "bilibili.com")),
    ODYSEE("Odysee", List.of("odysee.com")),
    RUMBLE("Rumble", List.of("rumble.com")),
    UNKNOWN("Unknown", List.of());

    private final String displayName;
    private final List<String> domains;

    SourcePlatform(String displayName, List<String> domains) {
        this.displayName = displayName;
        this.domains = domains;
    }

    public String displayName() {
        return displayName;
    }

    public static SourcePlatform detect(String sourceRef) {
        String host = hostOf(sourceRef);
        if (host == null) {
            return UNKNOWN;
        }

        for (SourcePlatform platform : values()) {
            for (String domain : platform.domains) {
                if (host.equals(domain) || host.endsWith("." + domain)) {
                    return platform;
                }
            }
        }
        return UNKNOWN;
    }

    private static String hostOf(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            return null;
        }
        try {
            String host = new URI(sourceRef.trim()).getHost();
            return host == null ? null : host.toLowerCase(Locale.ROOT);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
