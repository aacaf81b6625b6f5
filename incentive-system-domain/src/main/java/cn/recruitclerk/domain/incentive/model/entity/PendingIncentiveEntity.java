package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class PendingIncentiveEntity {

    private IncentiveSummaryEntity summary;
    private ProcessingPriorityEntity priority;

}
