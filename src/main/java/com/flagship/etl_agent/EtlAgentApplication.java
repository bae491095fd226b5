package com.flagship.etl_agent;

import com.flagship.etl_agent.dispatch.DispatchProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.autoconfigure.data.redis.RedisRepositoriesAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication(exclude = RedisRepositoriesAutoConfiguration.class)
@EnableConfigurationProperties(DispatchProperties.class)
public class EtlAgentApplication {

    public static void main(String[] args) {
        SpringApplication.run(EtlAgentApplication.class, args);
    }
}
