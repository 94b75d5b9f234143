package com.steakz.backend.modules.feedback.application;

import java.util.List;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.BranchAccessGuard;
import com.steakz.backend.modules.access.domain.Actor;
import com.steakz.backend.modules.access.domain.ProtectedOperation;
import com.steakz.backend.modules.access.domain.Role;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.feedback.domain.Feedback;
import com.steakz.backend.modules.feedback.infrastructure.persistence.FeedbackRepository;
import com.steakz.backend.modules.feedback.presentation.dto.CreateFeedbackRequest;
import com.steakz.backend.modules.feedback.presentation.dto.FeedbackResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FeedbackService {

    private static final Logger log = LoggerFactory.getLogger(FeedbackService.class);

    private final FeedbackRepository feedbackRepository;
    private final BranchRepository branchRepository;
    private final BranchAccessGuard accessGuard;

    public FeedbackService(
            FeedbackRepository feedbackRepository,
            BranchRepository branchRepository,
            BranchAccessGuard accessGuard
    ) {
        this.feedbackRepository = feedbackRepository;
        this.branchRepository = branchRepository;
        this.accessGuard = accessGuard;
    }

    @Transactional
    public FeedbackResponse create(Actor actor, CreateFeedbackRequest request) {
        Long branchId = accessGuard.authorizeBranchScope(ProtectedOperation.FEEDBACK_CREATE, actor, request.branchId());
        if (!branchRepository.existsById(branchId)) {
            throw ProblemException.notFound("branch.not_found", "branch " + branchId + " does not exist");
        }
        Feedback feedback = new Feedback(actor.id(), branchId, request.rating(), request.comment().trim());
        return FeedbackResponse.from(feedbackRepository.save(feedback));
    }

    /**
     * Newest first. Customers only see what they wrote themselves.
     */
    @Transactional(readOnly = true)
    public List<FeedbackResponse> listForBranch(Actor actor, String pathBranchId) {
        Long branchId = accessGuard.authorizeBranchPath(ProtectedOperation.FEEDBACK_LIST, actor, pathBranchId);
        List<Feedback> feedback = actor.hasRole(Role.CUSTOMER)
                ? feedbackRepository.findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(branchId, actor.id())
                : feedbackRepository.findByBranchIdOrderByCreatedAtDescIdDesc(branchId);
        return feedback.stream().map(FeedbackResponse::from).toList();
    }

    @Transactional
    public FeedbackResponse reply(Actor actor, Long feedbackId, String reply) {
        Feedback feedback = loadAuthorized(ProtectedOperation.FEEDBACK_REPLY, actor, feedbackId);
        feedback.setReply(reply.trim());
        return FeedbackResponse.from(feedback);
    }

    @Transactional
    public FeedbackResponse approve(Actor actor, Long feedbackId) {
        Feedback feedback = loadAuthorized(ProtectedOperation.FEEDBACK_APPROVE, actor, feedbackId);
        feedback.approve();
        return FeedbackResponse.from(feedback);
    }

    @Transactional
    public void delete(Actor actor, Long feedbackId) {
        Feedback feedback = loadAuthorized(ProtectedOperation.FEEDBACK_DELETE, actor, feedbackId);
        feedbackRepository.delete(feedback);
        log.info("Feedback {} of branch {} deleted by user {}", feedbackId, feedback.getBranchId(), actor.id());
    }

    private Feedback loadAuthorized(ProtectedOperation operation, Actor actor, Long feedbackId) {
        accessGuard.authorizeResource(operation, actor,
                () -> feedbackRepository.findBranchIdById(feedbackId).orElseThrow(() -> notFound(feedbackId)));
        return feedbackRepository.findById(feedbackId).orElseThrow(() -> notFound(feedbackId));
    }

    private static ProblemException notFound(Long id) {
        return ProblemException.notFound("feedback.not_found", "feedback " + id + " not found");
    }
}
