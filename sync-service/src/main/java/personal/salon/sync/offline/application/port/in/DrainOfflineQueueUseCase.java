package personal.salon.sync.offline.application.port.in;

public interface DrainOfflineQueueUseCase {

    /**
     * 처리 시점이 된 작업을 최대 batch-size개 처리 (없으면 no-op)
     */
    DrainResult drain();

    /**
     * claim timeout을 넘긴 PROCESSING 작업을 PENDING으로 복구
     *
     * @return 복구된 작업 수
     */
    int recoverStaleClaims();
}
