package cn.recruitclerk.infrastructure.util;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.entity.IncentiveDataEntity;
import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import cn.recruitclerk.types.enums.ResponseCode;
import cn.recruitclerk.types.exception.AppException;
import com.alibaba.fastjson.JSON;
import com.alibaba.fastjson.JSONException;
import org.apache.commons.lang3.StringUtils;

/**
 * 激励持久化数据 JSON 编解码，供仓储实现存取文档型数据
 */
public class IncentiveDataJsonUtil {

    public static String toJson(IncentiveAggregate incentive) {
        return JSON.toJSONString(incentive.toData());
    }

    public static IncentiveDataEntity parse(String json) {
        if (StringUtils.isBlank(json)) {
            throw new AppException(ResponseCode.E0107, "Incentive data is empty");
        }
        try {
            return JSON.parseObject(json, IncentiveDataEntity.class);
        } catch (JSONException e) {
            throw new AppException(ResponseCode.E0107, "Incentive data is not valid JSON", e);
        }
    }

    public static IncentiveAggregate restore(String json, IncentivePolicyVO policy) {
        return IncentiveAggregate.restore(parse(json), policy);
    }

}
