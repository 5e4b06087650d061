package com.finexec.adapter.out.persistence;

import com.finexec.application.port.out.ReportDraftRepository;
import com.finexec.domain.model.ReportDraft;
import io.vertx.core.Future;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory draft store; a draft lives until its quarter's closing balances are published
 */
@Slf4j
public class InMemoryReportDraftAdapter implements ReportDraftRepository {

    private final Map<String, ReportDraft> drafts = new ConcurrentHashMap<>();

    @Override
    public Future<Void> save(ReportDraft draft) {
        drafts.put(draft.getReportId(), draft);
        log.debug("Saved draft {}", draft.getReportId());
        return Future.succeededFuture();
    }

    @Override
    public Future<Optional<ReportDraft>> findById(String reportId) {
        return Future.succeededFuture(Optional.ofNullable(reportId == null ? null : drafts.get(reportId)));
    }

    @Override
    public Future<Void> delete(String reportId) {
        if (reportId != null && drafts.remove(reportId) != null) {
            log.debug("Deleted draft {}", reportId);
        }
        return Future.succeededFuture();
    }
}
