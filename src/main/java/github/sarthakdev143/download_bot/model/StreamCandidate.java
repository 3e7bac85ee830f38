package github.sarthakdev143.download_bot.model;

public record StreamCandidate(
        String uri,
        String extension,
        boolean hasVideo,
        boolean hasAudio,
        Integer height,
        Long expectedSizeBytes,
        StreamCandidate audioTrack) {

    public StreamCandidate(String uri, String extension, boolean hasVideo, boolean hasAudio,
                           Integer height, Long expectedSizeBytes) {
        this(uri, extension, hasVideo, hasAudio, height, expectedSizeBytes, null);
    }

    // a video-only stream paired with a separate audio stream still yields sound once muxed
    public boolean carriesAudio() {
        return hasAudio || audioTrack != null;
    }

    public StreamCandidate withAudioTrack(StreamCandidate track) {
        return new StreamCandidate(uri, extension, hasVideo, hasAudio, height, expectedSizeBytes, track);
    }
}
