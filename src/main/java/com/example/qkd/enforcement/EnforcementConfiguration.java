package com.example.qkd.enforcement;

import com.example.qkd.config.QkdProperties;
import com.example.qkd.service.KeyManager;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * qkd.enforcement.enabled=true 时装配执行端。
 */
@Configuration
@ConditionalOnProperty(prefix = "qkd.enforcement", name = "enabled", havingValue = "true")
public class EnforcementConfiguration {

    @Bean(initMethod = "start", destroyMethod = "stop")
    public LinkEnforcementAgent linkEnforcementAgent(QkdProperties props,
                                                     KeyManager keyManager,
                                                     ObjectMapper objectMapper) {
        QkdProperties.Enforcement cfg = props.getEnforcement();

        LinkHealthSource source = cfg.getSource() == QkdProperties.SourceType.HTTP
                ? new HttpLinkHealthSource(cfg.getKmsUrl(), objectMapper, cfg.getHttpTimeout())
                : keyManager;

        PacketFilter filter = cfg.getFilter() == QkdProperties.FilterType.COMMAND
                ? new CommandPacketFilter(cfg.getBlockCommands(), cfg.getAllowCommands(), cfg.getCommandTimeout())
                : new LoggingPacketFilter();

        return new LinkEnforcementAgent(source, filter, cfg.getUnknownPolicy(),
                cfg.getPollInterval(), cfg.isReleaseOnStop());
    }
}
