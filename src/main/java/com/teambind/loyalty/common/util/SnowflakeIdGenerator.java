package com.teambind.loyalty.common.util;

import java.time.Clock;

/**
 * 쿠폰/이력 식별자 생성기 (Snowflake 방식)
 *
 * ID 구조 (63 bits):
 * - 41 bits: 타임스탬프 (밀리초, EPOCH 기준)
 * - 10 bits: 노드 ID (기기/프로세스 구분)
 * - 12 bits: 시퀀스 (같은 밀리초 내에서 증가)
 *
 * 외부에 노출되는 식별자는 "접두사_base36" 형태의 불투명 문자열입니다.
 */
public class SnowflakeIdGenerator {

    private static final long EPOCH = 1704067200000L; // 2024-01-01 00:00:00 UTC
    private static final long NODE_ID_BITS = 10L;
    private static final long SEQUENCE_BITS = 12L;

    private static final long MAX_NODE_ID = ~(-1L << NODE_ID_BITS);
    private static final long MAX_SEQUENCE = ~(-1L << SEQUENCE_BITS);

    private static final long NODE_ID_SHIFT = SEQUENCE_BITS;
    private static final long TIMESTAMP_SHIFT = SEQUENCE_BITS + NODE_ID_BITS;

    private final long nodeId;
    private final Clock clock;

    private long sequence = 0L;
    private long lastTimestamp = -1L;

    public SnowflakeIdGenerator(long nodeId, Clock clock) {
        if (nodeId > MAX_NODE_ID || nodeId < 0) {
            throw new IllegalArgumentException("Node ID must be between 0 and " + MAX_NODE_ID);
        }
        this.nodeId = nodeId;
        this.clock = clock;
    }

    public synchronized long nextId() {
        long timestamp = clock.millis();

        // 시계가 뒤로 가면 마지막 타임스탬프를 계속 사용 (기기 시간 변경 대응)
        if (timestamp < lastTimestamp) {
            timestamp = lastTimestamp;
        }

        if (timestamp == lastTimestamp) {
            sequence = (sequence + 1) & MAX_SEQUENCE;
            if (sequence == 0) {
                // 시퀀스 소진 시 논리 시각을 1ms 앞당김
                timestamp = lastTimestamp + 1;
            }
        } else {
            sequence = 0L;
        }

        lastTimestamp = timestamp;

        return ((timestamp - EPOCH) << TIMESTAMP_SHIFT) |
                (nodeId << NODE_ID_SHIFT) |
                sequence;
    }

    /**
     * 접두사가 붙은 문자열 ID 생성
     *
     * @param prefix 식별자 종류 (예: "coupon", "history")
     */
    public String nextId(String prefix) {
        return prefix + "_" + Long.toString(nextId(), 36);
    }
}
