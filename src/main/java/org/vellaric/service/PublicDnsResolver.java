package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.vellaric.config.NetworkProperties;
import org.vellaric.dto.CommandResult;
import org.vellaric.dto.PollOutcome;
import org.vellaric.dto.PollPolicy;
import org.vellaric.dto.ProbeResult;

/**
 * 通过公共 DNS 服务器（dig）确认域名已经可以解析
 */
@Slf4j
@Component
public class PublicDnsResolver {
    
    private final NetworkProperties networkProperties;
    
    private final ProcessRunner processRunner;
    
    private final HealthPoller healthPoller;
    
    public PublicDnsResolver(NetworkProperties networkProperties, ProcessRunner processRunner, HealthPoller healthPoller) {
        this.networkProperties = networkProperties;
        this.processRunner = processRunner;
        this.healthPoller = healthPoller;
    }
    
    public boolean resolves(String domain) {
        CommandResult result = processRunner.run("dig", "+short", domain, "@" + networkProperties.getDns().getResolver());
        return result.isSuccess() && !result.getOutput().trim().isEmpty();
    }
    
    /**
     * @return 在限定时间内解析成功
     */
    public boolean waitForPropagation(String domain, CancellationToken token) {
        NetworkProperties.Dns dns = networkProperties.getDns();
        PollPolicy policy = PollPolicy.of(dns.getPropagationInterval(), dns.getPropagationMaxAttempts());
        PollOutcome outcome = healthPoller.poll("DNS " + domain, policy,
            attempt -> resolves(domain) ? ProbeResult.ready(domain) : ProbeResult.waiting(), token);
        return outcome.isReady();
    }
}
