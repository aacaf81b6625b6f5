package cn.recruitclerk.domain.incentive.model.valobj;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Date;

/**
 * @description 查询时间范围，端点为空表示不限
 * @create 2026-10-17
 */
@Data
@Builder
@AllArgsConstructor
@NoArgsConstructor
public class TimeRangeVO {

    /** 开始时间（含） */
    private Date start;
    /** 结束时间（含） */
    private Date end;

    public boolean contains(Date time) {
        if (null == time) return false;
        if (null != start && time.before(start)) return false;
        return null == end || !time.after(end);
    }

}
