package github.sarthakdev143.download_bot.integration.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;

public final class SourceUrls {

    private SourceUrls() {
    }

    public static Optional<URI> parseHttpUrl(String sourceRef) {
        if (sourceRef == null || sourceRef.isBlank()) {
            return Optional.empty();
        }
        try {
            URI uri = new URI(sourceRef.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return Optional.empty();
            }
            if (uri.getHost() == null || uri.getHost().isBlank()) {
                return Optional.empty();
            }
            return Optional.of(uri);
        } catch (URISyntaxException e) {
            return Optional.empty();
        }
    }

    public static String extensionOf(URI uri) {
        String path = uri.getPath();
        if (path == null) {
            return "";
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        if (dot < 0 || dot == lastSegment.length() - 1) {
            return "";
        }
        return lastSegment.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    public static String baseNameOf(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isBlank()) {
            return uri.getHost();
        }
        String lastSegment = path.substring(path.lastIndexOf('/') + 1);
        int dot = lastSegment.lastIndexOf('.');
        String baseName = dot > 0 ? lastSegment.substring(0, dot) : lastSegment;
        return baseName.isBlank() ? uri.getHost() : baseName;
    }
}
