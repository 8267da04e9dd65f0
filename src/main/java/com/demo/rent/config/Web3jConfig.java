package com.demo.rent.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.http.HttpService;

@Slf4j
@Configuration
public class Web3jConfig {

    @Bean(destroyMethod = "shutdown")
    public Web3j web3j(@Value("${web3.rpc-url:http://127.0.0.1:8545}") String rpc) {
        log.info("web3j JSON-RPC endpoint: {}", rpc);
        return Web3j.build(new HttpService(rpc));
    }
}
