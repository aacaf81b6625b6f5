package cn.recruitclerk.domain.incentive.model.entity;

import cn.recruitclerk.types.enums.ResponseCode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Collections;
import java.util.List;

/**
 * @description 领域服务统一返回结果，调用方需先判断 success 再读取 data
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class IncentiveOperationResult<T> {

    /** 是否成功 */
    private boolean success;
    /** 响应码 */
    private String code;
    /** 响应信息 */
    private String info;
    /** 失败原因 */
    private List<String> errors;
    /** 结果数据 */
    private T data;

    public static <T> IncentiveOperationResult<T> success(T data) {
        return IncentiveOperationResult.<T>builder()
                .success(true)
                .code(ResponseCode.SUCCESS.getCode())
                .info(ResponseCode.SUCCESS.getInfo())
                .errors(Collections.emptyList())
                .data(data)
                .build();
    }

    public static <T> IncentiveOperationResult<T> failed(ResponseCode responseCode, List<String> errors) {
        return IncentiveOperationResult.<T>builder()
                .success(false)
                .code(responseCode.getCode())
                .info(responseCode.getInfo())
                .errors(errors)
                .build();
    }

    public static <T> IncentiveOperationResult<T> failed(ResponseCode responseCode, String error) {
        return failed(responseCode, Collections.singletonList(error));
    }

}
