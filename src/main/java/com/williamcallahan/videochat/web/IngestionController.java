package com.williamcallahan.videochat.web;

import com.williamcallahan.videochat.domain.IngestionResult;
import com.williamcallahan.videochat.service.ingestion.VideoIngestionService;
import com.williamcallahan.videochat.service.vector.ReconciliationReport;
import com.williamcallahan.videochat.service.vector.VectorIndexReconciliationService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/ingestion")
public class IngestionController extends BaseController {
    private static final Logger log = LoggerFactory.getLogger(IngestionController.class);

    private final VideoIngestionService ingestionService;
    private final VectorIndexReconciliationService reconciliationService;

    public IngestionController(
            VideoIngestionService ingestionService,
            VectorIndexReconciliationService reconciliationService,
            ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.ingestionService = ingestionService;
        this.reconciliationService = reconciliationService;
    }

    /**
     * Downloads, transcribes, chunks, embeds and indexes one video. Blocks until done.
     */
    @PostMapping("/videos")
    public IngestionResult ingest(@Valid @RequestBody IngestVideoRequest request) {
        log.info("[INGEST] Ingestion requested for {}", request.url());
        return ingestionService.ingest(request.url());
    }

    /**
     * Re-embeds and upserts chunks whose vector point is missing.
     */
    @PostMapping("/videos/{videoId}/reconcile")
    public ReconciliationReport reconcile(@PathVariable("videoId") String videoId) {
        return reconciliationService.reconcile(videoId);
    }
}
