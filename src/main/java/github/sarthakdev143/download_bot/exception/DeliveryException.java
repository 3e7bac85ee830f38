package github.sarthakdev143.download_bot.exception;

import github.sarthakdev143.download_bot.model.FailureKind;

public class DeliveryException extends MediaPipelineException {

    public DeliveryException(String message) {
        super(FailureKind.DELIVERY_ERROR, message);
    }

    public DeliveryException(String message, Throwable cause) {
        super(FailureKind.DELIVERY_ERROR, message, cause);
    }
}
