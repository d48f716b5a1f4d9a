package com.teambind.loyalty.application.port.out;

/**
 * 포인트 원장 (외부 협력자)
 *
 * 두 호출 모두 실패할 수 있으며, 쿠폰 엔진은 반환값 외의 부수효과를 보지 않습니다.
 */
public interface PointLedgerPort {

    /**
     * 포인트 차감
     *
     * @param amount 양수 금액
     * @param reason 차감 사유
     * @return 차감 성공 여부
     */
    boolean spendPoints(long amount, String reason);

    /**
     * 포인트 적립 (보상 환불에 사용)
     *
     * @param amount 양수 금액
     * @param reason 적립 사유
     * @return 적립 성공 여부
     */
    boolean addPoints(long amount, String reason);
}
