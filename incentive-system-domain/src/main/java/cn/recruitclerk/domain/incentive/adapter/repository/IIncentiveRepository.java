package cn.recruitclerk.domain.incentive.adapter.repository;

import cn.recruitclerk.domain.incentive.model.aggregate.IncentiveAggregate;
import cn.recruitclerk.domain.incentive.model.valobj.IncentiveStatusEnumVO;
import cn.recruitclerk.domain.incentive.model.valobj.TimeRangeVO;

import java.util.List;

/**
 * @description 激励仓储接口
 * @create 2026-10-17
 */
public interface IIncentiveRepository {

    /**
     * 保存激励（乐观锁）
     * <p>
     * 仅当库中版本号等于 {@link IncentiveAggregate#getVersion()}（新建时为 0 且不存在）时写入，写入后版本号 +1。
     * </p>
     *
     * @param incentive 激励聚合
     * @return false 表示版本冲突，未写入
     */
    boolean save(IncentiveAggregate incentive);

    IncentiveAggregate findById(String id);

    /**
     * 按ID批量查询，不存在的ID直接忽略
     */
    List<IncentiveAggregate> findByIds(List<String> ids);

    /**
     * @param ip        收款人IP
     * @param timeRange 创建时间范围，可为空
     */
    List<IncentiveAggregate> findByIP(String ip, TimeRangeVO timeRange);

    List<IncentiveAggregate> findAll(TimeRangeVO timeRange);

    /**
     * 查询待处理激励
     *
     * @param status 状态过滤，为空时返回待校验与已审核的激励
     * @param limit  最大条数
     */
    List<IncentiveAggregate> findPendingIncentives(IncentiveStatusEnumVO status, int limit);

    IncentiveAggregate findReferralIncentive(String referrerIP, String referredIP);

    int countTodayIncentives(String ip);

    /**
     * 删除创建时间早于指定天数的激励
     *
     * @return 删除条数
     */
    int deleteExpired(int olderThanDays);

}
