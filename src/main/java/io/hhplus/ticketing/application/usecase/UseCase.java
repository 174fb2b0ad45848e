package io.hhplus.ticketing.application.usecase;

import org.springframework.stereotype.Component;

import java.lang.annotation.*;

/**
 * 하나의 사용자 시나리오(발권, 환불, 조회)를 담당하는 애플리케이션 컴포넌트 표식
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Component
public @interface UseCase {
    String value() default "";
}
