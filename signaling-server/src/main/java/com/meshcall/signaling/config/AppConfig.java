package com.meshcall.signaling.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.meshcall.protocol.SignalMessageCodec;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 공용 Bean 정의를 담고 있는 설정 클래스.
 */
@Configuration
public class AppConfig {

	/**
	 * 방 생성/유휴 시각 계산에 쓰는 시계. 테스트에서 고정 시계로 바꿔 끼울 수 있다.
	 */
	@Bean
	public Clock clock() {
		return Clock.systemUTC();
	}

	/**
	 * Spring이 구성한 ObjectMapper를 그대로 사용해 시그널링 메시지를 읽고 쓴다.
	 */
	@Bean
	public SignalMessageCodec signalMessageCodec(ObjectMapper objectMapper) {
		return new SignalMessageCodec(objectMapper);
	}

}
