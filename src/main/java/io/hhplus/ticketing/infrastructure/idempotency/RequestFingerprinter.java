package io.hhplus.ticketing.infrastructure.idempotency;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.hhplus.ticketing.common.exception.BusinessException;
import io.hhplus.ticketing.common.exception.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * 요청 본문 지문(fingerprint) 계산기
 * <p>
 * 요청을 정규화된 JSON(키 정렬, 공백 없음)으로 직렬화한 뒤 SHA-256 해시를 구한다.
 * 필드 순서나 포맷이 달라도 논리적으로 같은 요청은 같은 지문을 가진다.
 */
public class RequestFingerprinter {

    private static final String HASH_ALGORITHM = "SHA-256";

    private final ObjectMapper canonicalMapper;

    public RequestFingerprinter(ObjectMapper objectMapper) {
        this.canonicalMapper = objectMapper.copy()
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(SerializationFeature.INDENT_OUTPUT);
    }

    public String fingerprint(Object requestBody) {
        return sha256Hex(canonicalize(requestBody));
    }

    /**
     * 객체 → Map/List 트리 → 키 정렬 JSON
     * (record 프로퍼티 순서에 의존하지 않도록 Map으로 한 번 변환한다)
     */
    String canonicalize(Object requestBody) {
        try {
            Object tree = canonicalMapper.convertValue(requestBody, Object.class);
            return canonicalMapper.writeValueAsString(tree);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new BusinessException(ErrorCode.INVALID_INPUT, "요청 본문을 정규화할 수 없습니다", e);
        }
    }

    private String sha256Hex(String canonical) {
        try {
            MessageDigest digest = MessageDigest.getInstance(HASH_ALGORITHM);
            byte[] hash = digest.digest(canonical.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(HASH_ALGORITHM + " is not available", e);
        }
    }
}
