package github.sarthakdev143.download_bot.integration.http;

import com.google.api.client.http.HttpResponse;
import com.google.api.client.http.HttpResponseException;
import github.sarthakdev143.download_bot.exception.MediaPipelineException;
import github.sarthakdev143.download_bot.model.FailureKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

final class HttpFailures {

    private static final Logger logger = LoggerFactory.getLogger(HttpFailures.class);
    private static final int REQUEST_TIMEOUT = 408;
    private static final int TOO_MANY_REQUESTS = 429;

    private HttpFailures() {
    }

    /**
     * 5xx, 408 and 429 are transient; any other error status means the stream itself is not
     * obtainable.
     */
    static MediaPipelineException classify(HttpResponseException e, String message) {
        if (isTransient(e.getStatusCode())) {
            return new MediaPipelineException(FailureKind.NETWORK_ERROR, message, e);
        }
        return new MediaPipelineException(FailureKind.RESOLVE_ERROR, message, e);
    }

    static boolean isTransient(int status) {
        return status >= 500 || status == REQUEST_TIMEOUT || status == TOO_MANY_REQUESTS;
    }

    static void disconnectQuietly(HttpResponse response) {
        if (response == null) {
            return;
        }
        try {
            response.disconnect();
        } catch (IOException e) {
            logger.debug("Error while disconnecting HTTP response", e);
        }
    }
}
