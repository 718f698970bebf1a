package com.nori.tc.deeplink.config;

import com.nori.tc.deeplink.beacon.BeaconStreamMonitor;
import com.nori.tc.deeplink.control.CommandDispatcher;
import com.nori.tc.deeplink.control.RestCommandDispatcher;
import com.nori.tc.deeplink.rasp.EnvironmentSecretProvider;
import com.nori.tc.deeplink.rasp.RaspScriptRunner;
import com.nori.tc.deeplink.rasp.RaspScriptValidator;
import com.nori.tc.deeplink.rasp.SecretProvider;
import com.nori.tc.deeplink.run.CertificationLauncher;
import com.nori.tc.deeplink.run.CertificationRunner;
import com.nori.tc.deeplink.sequencer.DeepLinkTestSequencer;
import com.nori.tc.deeplink.time.SystemTime;
import com.nori.tc.deeplink.wait.BeaconWaitCoordinator;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import java.time.Clock;

/**
 * 인증 run 구성요소 wiring.
 *
 * - 모든 대기/지연은 SystemTime(운영 시계)을 쓴다. 테스트는 각 클래스를 직접 조립한다.
 * - 빈 생성 시점에는 디바이스 I/O가 없다. 연결은 CertificationRunner.run()에서 연다.
 */
@Configuration
public class DeepLinkCertConfiguration {

    @Bean
    public BeaconStreamMonitor beaconStreamMonitor(DeepLinkProperties props) {
        return new BeaconStreamMonitor(props.getDiagnostics().getLogBufferSize(), props.isVerbose());
    }

    @Bean
    public CommandDispatcher commandDispatcher(DeepLinkProperties props, RestTemplateBuilder restTemplateBuilder) {
        return RestCommandDispatcher.create(props.controlEndpoint(), restTemplateBuilder);
    }

    @Bean
    public BeaconWaitCoordinator beaconWaitCoordinator(BeaconStreamMonitor monitor) {
        return new BeaconWaitCoordinator(monitor, SystemTime.INSTANCE, SystemTime.INSTANCE);
    }

    @Bean
    public SecretProvider secretProvider(Environment environment) {
        return new EnvironmentSecretProvider(environment);
    }

    @Bean
    public RaspScriptRunner raspScriptRunner(CommandDispatcher dispatcher, SecretProvider secrets) {
        return new RaspScriptRunner(dispatcher, secrets, SystemTime.INSTANCE);
    }

    @Bean
    public RaspScriptValidator raspScriptValidator() {
        return new RaspScriptValidator();
    }

    @Bean
    public DeepLinkTestSequencer deepLinkTestSequencer(CommandDispatcher dispatcher,
                                                       BeaconStreamMonitor monitor,
                                                       BeaconWaitCoordinator coordinator,
                                                       RaspScriptRunner scriptRunner) {
        return new DeepLinkTestSequencer(dispatcher, monitor, coordinator, scriptRunner,
                SystemTime.INSTANCE, SystemTime.INSTANCE);
    }

    @Bean
    public CertificationRunner certificationRunner(DeepLinkProperties props,
                                                   BeaconStreamMonitor monitor,
                                                   DeepLinkTestSequencer sequencer) {
        return new CertificationRunner(props.beaconEndpoint(),
                props.getDevice().getConnectTimeoutSec() * 1000L,
                monitor, sequencer, Clock.systemUTC());
    }

    @Bean
    public CertificationLauncher certificationLauncher(DeepLinkProperties props,
                                                       CertificationRunner runner,
                                                       RaspScriptValidator validator) {
        return new CertificationLauncher(props, runner, validator);
    }
}
