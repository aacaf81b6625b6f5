package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * @description 问卷完成触发
 * @create 2026-10-17
 */
@Getter
public class QuestionnaireTriggerVO extends IncentiveTriggerVO {

    public static final String KEY_QUESTIONNAIRE_ID = "questionnaireId";
    public static final String KEY_QUALITY_SCORE = "qualityScore";

    /** 问卷ID */
    private final String questionnaireId;
    /** 质量分 0-100 */
    private final Integer qualityScore;

    public QuestionnaireTriggerVO(String questionnaireId, Integer qualityScore, Date qualifiedAt) {
        super(qualifiedAt);
        this.questionnaireId = questionnaireId;
        this.qualityScore = qualityScore;
    }

    @Override
    public TriggerTypeEnumVO getTriggerType() {
        return TriggerTypeEnumVO.QUESTIONNAIRE_COMPLETION;
    }

    @Override
    public List<String> validate() {
        List<String> errors = new ArrayList<>();
        if (StringUtils.isBlank(questionnaireId)) {
            errors.add("Questionnaire ID is required");
        }
        if (null == qualityScore || qualityScore < 0 || qualityScore > 100) {
            errors.add("Valid quality score (0-100) is required");
        }
        return errors;
    }

    @Override
    public Map<String, Object> toTriggerData() {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put(KEY_QUESTIONNAIRE_ID, questionnaireId);
        data.put(KEY_QUALITY_SCORE, qualityScore);
        return data;
    }

}
