package personal.salon.sync.offline.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;
import personal.salon.sync.offline.domain.model.OperationStatus;

public class InvalidOperationStateException extends BusinessException {
    public InvalidOperationStateException(Long operationId, OperationStatus status, String action) {
        super(ErrorCode.INVALID_OPERATION_STATE,
                String.format("Cannot %s operation in %s state: id=%d", action, status, operationId));
    }
}
