package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.domain.incentive.model.valobj.PriorityLevelEnumVO;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * @description 处理优先级
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class ProcessingPriorityEntity {

    /** 优先级分数 0-100 */
    private int score;
    /** 优先级 */
    private PriorityLevelEnumVO level;
    /** 计分因素 */
    private List<String> factors;

}
