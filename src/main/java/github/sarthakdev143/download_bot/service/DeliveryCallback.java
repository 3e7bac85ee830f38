package github.sarthakdev143.download_bot.service;

import github.sarthakdev143.download_bot.exception.DeliveryException;
import github.sarthakdev143.download_bot.model.FailureKind;
import github.sarthakdev143.download_bot.model.MediaArtifact;
import github.sarthakdev143.download_bot.model.RequesterContext;

public interface DeliveryCallback {

    void onComplete(RequesterContext requesterContext, MediaArtifact artifact) throws DeliveryException;

    void onFailure(RequesterContext requesterContext, FailureKind failureKind, String detail) throws DeliveryException;
}
