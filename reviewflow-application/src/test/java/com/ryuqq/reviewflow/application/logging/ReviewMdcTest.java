package com.ryuqq.reviewflow.application.logging;

import com.ryuqq.reviewflow.core.model.ChangeProposal;
import com.ryuqq.reviewflow.core.model.Payload;
import com.ryuqq.reviewflow.core.model.Role;
import com.ryuqq.reviewflow.core.model.WorkItemId;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.assertThat;

class ReviewMdcTest {

    @AfterEach
    void tearDown() {
        ReviewMdc.clear();
    }

    @Test
    void setReview_제안_Work_Item_Phase_키를_설정함() {
        // given
        ChangeProposal proposal = ChangeProposal.forCode(WorkItemId.of("item-7"), 3, Role.IMPLEMENTER,
            Payload.of("x"), 1);

        // when
        ReviewMdc.setReview(proposal);

        // then
        assertThat(MDC.get("proposalId")).isEqualTo(proposal.id().getValue());
        assertThat(MDC.get("workItemId")).isEqualTo("item-7");
        assertThat(MDC.get("phase")).isEqualTo("3");
    }

    @Test
    void clear_모든_키를_제거함() {
        // given
        ReviewMdc.setPhase(2);

        // when
        ReviewMdc.clear();

        // then
        assertThat(MDC.get("phase")).isNull();
    }
}
