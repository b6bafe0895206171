package personal.salon.sync.offline.domain.exception;

import personal.salon.common.exception.BusinessException;
import personal.salon.common.exception.ErrorCode;

public class OperationNotFoundException extends BusinessException {
    public OperationNotFoundException(Long operationId) {
        super(ErrorCode.OPERATION_NOT_FOUND, String.format("Offline operation not found: id=%d", operationId));
    }
}
