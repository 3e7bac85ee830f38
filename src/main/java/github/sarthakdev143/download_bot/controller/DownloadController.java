package github.sarthakdev143.download_bot.controller;

import github.sarthakdev143.download_bot.dto.DownloadJobSubmissionResponse;
import github.sarthakdev143.download_bot.dto.DownloadRequest;
import github.sarthakdev143.download_bot.exception.QueueSaturatedException;
import github.sarthakdev143.download_bot.model.DownloadJobState;
import github.sarthakdev143.download_bot.model.OutputPreset;
import github.sarthakdev143.download_bot.model.RequesterContext;
import github.sarthakdev143.download_bot.service.DownloadService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/downloads")
public class DownloadController {

    private static final Logger logger = LoggerFactory.getLogger(DownloadController.class);

    private final DownloadService downloadService;

    public DownloadController(DownloadService downloadService) {
        this.downloadService = downloadService;
    }

    @PostMapping(consumes = "application/json")
    public ResponseEntity<?> submit(@RequestBody DownloadRequest request) {
        try {
            RequesterContext requesterContext = new RequesterContext(request.requesterId(), request.attributes());
            String jobId = downloadService.submit(request.sourceRef(), request.preset(), requesterContext);
            return ResponseEntity.accepted()
                    .body(new DownloadJobSubmissionResponse(
                            jobId,
                            DownloadJobState.QUEUED,
                            "Download job accepted. Poll /api/downloads/{jobId} for progress."));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body("Invalid request: " + e.getMessage());
        } catch (QueueSaturatedException e) {
            logger.warn("Rejected download request: {}", e.getMessage());
            return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS).body(e.getMessage());
        } catch (IllegalStateException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                    .body("Download service is shutting down. Please try again later.");
        } catch (Exception e) {
            logger.error("Download submission failed", e);
            return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                    .body("Failed to queue download. Please try again.");
        }
    }

    @GetMapping("/presets")
    public List<String> presets() {
        return OutputPreset.names();
    }

    @GetMapping("/{jobId}")
    public ResponseEntity<?> getStatus(@PathVariable String jobId) {
        return downloadService.getJobStatus(jobId)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Job not found for id: " + jobId));
    }

    @DeleteMapping("/{jobId}")
    public ResponseEntity<?> cancel(@PathVariable String jobId) {
        if (downloadService.cancel(jobId)) {
            return ResponseEntity.accepted().body("Cancellation requested for job " + jobId + ".");
        }
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No active job found for id: " + jobId);
    }
}
