package personal.salon.sync.offline.application.port.in;

/**
 * Drain 1회 결과
 *
 * @param requeued     FAILED → PENDING 재등록 수
 * @param claimed      이번 회차에 처리한 작업 수
 * @param keptExisting 서버 값 유지로 하위 호출 없이 완료된 수
 */
public record DrainResult(
        int requeued,
        int claimed,
        int completed,
        int keptExisting,
        int failed,
        int deadLettered) {

    public static DrainResult empty(int requeued) {
        return new DrainResult(requeued, 0, 0, 0, 0, 0);
    }

    public int processed() {
        return claimed;
    }
}
