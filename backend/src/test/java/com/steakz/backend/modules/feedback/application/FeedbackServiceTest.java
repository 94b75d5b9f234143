package com.steakz.backend.modules.feedback.application;

import static com.steakz.backend.support.AccessFixtures.ADMIN;
import static com.steakz.backend.support.AccessFixtures.BRANCH_1;
import static com.steakz.backend.support.AccessFixtures.BRANCH_2;
import static com.steakz.backend.support.AccessFixtures.CUSTOMER_B1;
import static com.steakz.backend.support.AccessFixtures.FRONT_B1;
import static com.steakz.backend.support.AccessFixtures.KITCHEN_B1;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Optional;

import com.steakz.backend.global.error.ProblemException;
import com.steakz.backend.modules.access.application.AccessDeniedProblem;
import com.steakz.backend.modules.access.domain.AccessOutcome;
import com.steakz.backend.modules.branch.infrastructure.persistence.BranchRepository;
import com.steakz.backend.modules.feedback.domain.Feedback;
import com.steakz.backend.modules.feedback.infrastructure.persistence.FeedbackRepository;
import com.steakz.backend.modules.feedback.presentation.dto.CreateFeedbackRequest;
import com.steakz.backend.modules.feedback.presentation.dto.FeedbackResponse;
import com.steakz.backend.support.AccessFixtures;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FeedbackServiceTest {

    @Mock
    private FeedbackRepository feedbackRepository;

    @Mock
    private BranchRepository branchRepository;

    private FeedbackService feedbackService;

    @BeforeEach
    void setUp() {
        feedbackService = new FeedbackService(feedbackRepository, branchRepository, AccessFixtures.guard());
    }

    @Test
    void customerFeedbackGoesToHomeBranch() {
        when(branchRepository.existsById(BRANCH_1)).thenReturn(true);
        when(feedbackRepository.save(any(Feedback.class))).thenAnswer(invocation -> invocation.getArgument(0));

        FeedbackResponse response = feedbackService.create(CUSTOMER_B1, new CreateFeedbackRequest("2", 5, "  Perfect medium rare  "));

        assertThat(response.branchId()).isEqualTo(BRANCH_1);
        assertThat(response.comment()).isEqualTo("Perfect medium rare");
        assertThat(response.approved()).isFalse();
    }

    @Test
    void adminFeedbackForUnknownBranchIsNotFound() {
        when(branchRepository.existsById(404L)).thenReturn(false);

        assertThatThrownBy(() -> feedbackService.create(ADMIN, new CreateFeedbackRequest("404", 4, "Lovely")))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("branch.not_found");
        verify(feedbackRepository, never()).save(any());
    }

    @Test
    void customerListsOnlyOwnFeedback() {
        when(feedbackRepository.findByBranchIdAndUserIdOrderByCreatedAtDescIdDesc(BRANCH_1, CUSTOMER_B1.id()))
                .thenReturn(List.of(new Feedback(CUSTOMER_B1.id(), BRANCH_1, 4, "Good")));

        assertThat(feedbackService.listForBranch(CUSTOMER_B1, "1")).hasSize(1);
        verify(feedbackRepository, never()).findByBranchIdOrderByCreatedAtDescIdDesc(anyLong());
    }

    @Test
    void frontStaffRepliesAndApprovesInOwnBranch() {
        Feedback feedback = new Feedback(CUSTOMER_B1.id(), BRANCH_1, 3, "Slow service");
        when(feedbackRepository.findBranchIdById(12L)).thenReturn(Optional.of(BRANCH_1));
        when(feedbackRepository.findById(12L)).thenReturn(Optional.of(feedback));

        feedbackService.reply(FRONT_B1, 12L, " Sorry, we are on it ");
        FeedbackResponse approved = feedbackService.approve(FRONT_B1, 12L);

        assertThat(approved.reply()).isEqualTo("Sorry, we are on it");
        assertThat(approved.approved()).isTrue();
    }

    @Test
    void frontStaffCannotTouchOtherBranchFeedback() {
        when(feedbackRepository.findBranchIdById(13L)).thenReturn(Optional.of(BRANCH_2));

        assertThatThrownBy(() -> feedbackService.delete(FRONT_B1, 13L))
                .isInstanceOf(AccessDeniedProblem.class)
                .extracting(ex -> ((AccessDeniedProblem) ex).getOutcome())
                .isEqualTo(AccessOutcome.FORBIDDEN_BRANCH);
        verify(feedbackRepository, never()).delete(any());
    }

    @Test
    void kitchenStaffCannotModerateFeedback() {
        assertThatThrownBy(() -> feedbackService.approve(KITCHEN_B1, 12L))
                .isInstanceOf(AccessDeniedProblem.class)
                .extracting(ex -> ((AccessDeniedProblem) ex).getOutcome())
                .isEqualTo(AccessOutcome.FORBIDDEN_CATEGORY);
        verify(feedbackRepository, never()).findBranchIdById(anyLong());
    }

    @Test
    void adminDeletesAnywhere() {
        Feedback feedback = new Feedback(9L, BRANCH_2, 1, "Cold fries");
        when(feedbackRepository.findBranchIdById(14L)).thenReturn(Optional.of(BRANCH_2));
        when(feedbackRepository.findById(14L)).thenReturn(Optional.of(feedback));

        feedbackService.delete(ADMIN, 14L);

        verify(feedbackRepository).delete(feedback);
    }

    @Test
    void missingFeedbackIsNotFound() {
        when(feedbackRepository.findBranchIdById(15L)).thenReturn(Optional.empty());

        assertThatThrownBy(() -> feedbackService.reply(ADMIN, 15L, "hi"))
                .isInstanceOf(ProblemException.class)
                .extracting(ex -> ((ProblemException) ex).getCode())
                .isEqualTo("feedback.not_found");
    }
}
