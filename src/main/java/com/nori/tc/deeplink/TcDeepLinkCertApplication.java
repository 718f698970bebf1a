package com.nori.tc.deeplink;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * tc-deeplink-cert
 *
 * - 기동 후 CertificationLauncher가 run 1회를 수행하고, 그 종료 코드로 프로세스를 끝낸다.
 * - @ConfigurationPropertiesScan으로 tc.deeplink.* 설정 모델을 스캔한다.
 */
@SpringBootApplication
@ConfigurationPropertiesScan(basePackages = "com.nori.tc.deeplink")
public class TcDeepLinkCertApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(TcDeepLinkCertApplication.class, args)));
    }
}
