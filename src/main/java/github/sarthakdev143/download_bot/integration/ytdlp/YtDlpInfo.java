package github.sarthakdev143.download_bot.integration.ytdlp;

import com.google.api.client.json.GenericJson;
import com.google.api.client.util.Key;

import java.util.List;

public class YtDlpInfo extends GenericJson {

    @Key
    private String title;

    @Key
    private String url;

    @Key
    private String ext;

    @Key
    private String vcodec;

    @Key
    private String acodec;

    @Key
    private Integer height;

    @Key
    private Double filesize;

    @Key
    private List<Format> formats;

    public String getTitle() {
        return title;
    }

    public String getUrl() {
        return url;
    }

    public String getExt() {
        return ext;
    }

    public String getVcodec() {
        return vcodec;
    }

    public String getAcodec() {
        return acodec;
    }

    public Integer getHeight() {
        return height;
    }

    public Double getFilesize() {
        return filesize;
    }

    public List<Format> getFormats() {
        return formats == null ? List.of() : formats;
    }

    public static class Format extends GenericJson {

        @Key("format_id")
        private String formatId;

        @Key
        private String url;

        @Key
        private String ext;

        @Key
        private String protocol;

        @Key
        private String vcodec;

        @Key
        private String acodec;

        @Key
        private Integer height;

        @Key
        private Double abr;

        @Key
        private Double tbr;

        @Key
        private Double filesize;

        @Key("filesize_approx")
        private Double filesizeApprox;

        public String getFormatId() {
            return formatId;
        }

        public String getUrl() {
            return url;
        }

        public String getExt() {
            return ext;
        }

        public String getProtocol() {
            return protocol;
        }

        public String getVcodec() {
            return vcodec;
        }

        public String getAcodec() {
            return acodec;
        }

        public Integer getHeight() {
            return height;
        }

        public Double getAbr() {
            return abr;
        }

        public Double getTbr() {
            return tbr;
        }

        public Double getFilesize() {
            return filesize;
        }

        public Double getFilesizeApprox() {
            return filesizeApprox;
        }

        /**
         * Exact size when yt-dlp knows it, else its estimate, else {@code null}.
         */
        public Long knownSize() {
            if (filesize != null && filesize > 0) {
                return filesize.longValue();
            }
            return filesizeApprox != null && filesizeApprox > 0 ? filesizeApprox.longValue() : null;
        }
    }
}
