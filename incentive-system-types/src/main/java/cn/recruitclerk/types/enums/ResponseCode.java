package cn.recruitclerk.types.enums;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * @description 响应码枚举，按错误分类划分
 * @create 2026-10-17
 */
@Getter
@AllArgsConstructor
public enum ResponseCode {

    SUCCESS("0000", "成功"),
    UN_ERROR("0001", "未知失败"),
    ILLEGAL_PARAMETER("0002", "非法参数"),
    E0101("E0101", "参数校验失败"),
    E0102("E0102", "不满足激励资格"),
    E0103("E0103", "激励状态冲突"),
    E0104("E0104", "激励不存在"),
    E0105("E0105", "外部支付服务失败"),
    E0106("E0106", "激励已被并发修改"),
    E0107("E0107", "激励数据损坏"),
    ;

    private final String code;
    private final String info;

}
