package com.steakz.backend.modules.feedback.presentation;

import java.util.List;

import com.steakz.backend.modules.access.application.CurrentActorProvider;
import com.steakz.backend.modules.feedback.application.FeedbackService;
import com.steakz.backend.modules.feedback.presentation.dto.CreateFeedbackRequest;
import com.steakz.backend.modules.feedback.presentation.dto.FeedbackResponse;
import com.steakz.backend.modules.feedback.presentation.dto.ReplyFeedbackRequest;

import jakarta.validation.Valid;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/feedback")
public class FeedbackController {

    private final FeedbackService feedbackService;
    private final CurrentActorProvider actorProvider;

    public FeedbackController(FeedbackService feedbackService, CurrentActorProvider actorProvider) {
        this.feedbackService = feedbackService;
        this.actorProvider = actorProvider;
    }

    @PostMapping
    public ResponseEntity<FeedbackResponse> create(@Valid @RequestBody CreateFeedbackRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(feedbackService.create(actorProvider.currentActor(), request));
    }

    @GetMapping("/branch/{branchId}")
    public ResponseEntity<List<FeedbackResponse>> listForBranch(@PathVariable("branchId") String branchId) {
        return ResponseEntity.ok(feedbackService.listForBranch(actorProvider.currentActor(), branchId));
    }

    @PatchMapping("/{feedbackId}/reply")
    public ResponseEntity<FeedbackResponse> reply(
            @PathVariable("feedbackId") Long feedbackId,
            @Valid @RequestBody ReplyFeedbackRequest request
    ) {
        return ResponseEntity.ok(feedbackService.reply(actorProvider.currentActor(), feedbackId, request.reply()));
    }

    @Operation(summary = "Approve feedback", description = "Publishes a feedback entry of the caller's branch.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Approved"),
            @ApiResponse(responseCode = "403", description = "Role, category or branch check failed"),
            @ApiResponse(responseCode = "404", description = "Unknown feedback")
    })
    @PatchMapping("/{feedbackId}/approve")
    public ResponseEntity<FeedbackResponse> approve(@PathVariable("feedbackId") Long feedbackId) {
        return ResponseEntity.ok(feedbackService.approve(actorProvider.currentActor(), feedbackId));
    }

    @DeleteMapping("/{feedbackId}")
    public ResponseEntity<Void> delete(@PathVariable("feedbackId") Long feedbackId) {
        feedbackService.delete(actorProvider.currentActor(), feedbackId);
        return ResponseEntity.noContent().build();
    }
}
