package cn.recruitclerk.domain.incentive.model.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class StatusBreakdownEntity {

    /** 待校验 */
    private int pending;
    /** 已审核 */
    private int approved;
    /** 已支付 */
    private int paid;
    /** 已拒绝 */
    private int rejected;
    /** 已过期 */
    private int expired;

}
