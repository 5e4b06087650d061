package com.finexec.adapter.in.web.edit;

import com.finexec.adapter.in.web.ApiResponses;
import com.finexec.application.port.in.ExecutionReportUseCase;
import com.finexec.application.port.in.ExecutionReportUseCase.UpdateCommentCommand;
import io.vertx.core.Handler;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.RoutingContext;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Handles PUT /api/executions/reports/:reportId/activities/:code/comment
 */
@Slf4j
@RequiredArgsConstructor
public class UpdateCommentHandler implements Handler<RoutingContext> {

    private final ExecutionReportUseCase reportUseCase;

    @Override
    public void handle(RoutingContext context) {
        JsonObject requestBody = ApiResponses.requireBody(context);
        if (requestBody == null) {
            return;
        }

        UpdateCommentCommand command;
        try {
            EditRequests.CommentRequest request = requestBody.mapTo(EditRequests.CommentRequest.class);
            command = new UpdateCommentCommand(context.pathParam("reportId"), context.pathParam("code"),
                    request.comment());
        } catch (Exception e) {
            log.error("Error parsing request body", e);
            ApiResponses.sendError(context, 400, "Invalid request format: " + e.getMessage());
            return;
        }

        reportUseCase.updateComment(command)
                .onSuccess(view -> ApiResponses.sendReport(context, 200, view))
                .onFailure(error -> ApiResponses.sendFailure(context, error));
    }
}
