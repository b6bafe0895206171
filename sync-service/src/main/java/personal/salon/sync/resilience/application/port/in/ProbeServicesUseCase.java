package personal.salon.sync.resilience.application.port.in;

public interface ProbeServicesUseCase {

    /**
     * 설정된 대상 전체를 프로브하고 결과를 기록
     *
     * @return 프로브한 대상 수
     */
    int probeAll();
}
