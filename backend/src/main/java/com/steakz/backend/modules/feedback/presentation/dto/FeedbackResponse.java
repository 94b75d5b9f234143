package com.steakz.backend.modules.feedback.presentation.dto;

import java.time.OffsetDateTime;

import com.steakz.backend.modules.feedback.domain.Feedback;

public record FeedbackResponse(
        Long id,
        Long branchId,
        Long userId,
        int rating,
        String comment,
        String reply,
        boolean approved,
        OffsetDateTime createdAt
) {
    public static FeedbackResponse from(Feedback feedback) {
        return new FeedbackResponse(
                feedback.getId(),
                feedback.getBranchId(),
                feedback.getUserId(),
                feedback.getRating(),
                feedback.getComment(),
                feedback.getReply(),
                feedback.isApproved(),
                feedback.getCreatedAt()
        );
    }
}
