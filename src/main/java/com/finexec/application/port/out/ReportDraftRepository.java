package com.finexec.application.port.out;

import com.finexec.domain.model.ReportDraft;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Output port for report draft storage
 */
public interface ReportDraftRepository {

    Future<Void> save(ReportDraft draft);

    Future<Optional<ReportDraft>> findById(String reportId);

    Future<Void> delete(String reportId);
}
