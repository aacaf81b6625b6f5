package cn.recruitclerk.config;

import cn.recruitclerk.domain.incentive.model.valobj.IncentivePolicyVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 激励策略装配，配置非法时启动失败
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(IncentivePolicyProperties.class)
public class IncentivePolicyConfiguration {

    @Bean
    public IncentivePolicyVO incentivePolicy(IncentivePolicyProperties properties) {
        IncentivePolicyVO policy = properties.toPolicy();
        log.info("激励策略加载完成 {}", policy);
        return policy;
    }

}
