package personal.salon.sync.offline.adapter.in.web.dto;

import personal.salon.sync.offline.application.port.in.DrainResult;

public record DrainResponse(
        int processed,
        int requeued,
        int completed,
        int keptExisting,
        int failed,
        int deadLettered
) {
    public static DrainResponse from(DrainResult result) {
        return new DrainResponse(
                result.processed(),
                result.requeued(),
                result.completed(),
                result.keptExisting(),
                result.failed(),
                result.deadLettered());
    }
}
