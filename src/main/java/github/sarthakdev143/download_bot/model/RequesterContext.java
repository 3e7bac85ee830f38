package github.sarthakdev143.download_bot.model;

import java.util.Map;

public record RequesterContext(String requesterId, Map<String, String> attributes) {

    private static final String ANONYMOUS = "anonymous";

    public RequesterContext {
        requesterId = requesterId == null || requesterId.isBlank() ? ANONYMOUS : requesterId.trim();
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
    }

    public static RequesterContext of(String requesterId) {
        return new RequesterContext(requesterId, Map.of());
    }
}
