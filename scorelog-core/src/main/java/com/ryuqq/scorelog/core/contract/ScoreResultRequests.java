package com.ryuqq.scorelog.core.contract;

import com.ryuqq.scorelog.core.model.LogItem;
import com.ryuqq.scorelog.core.model.PersistedRecord;

import java.util.List;

/**
 * 점수 결과 저장 요청.
 *
 * @author ScoreLog Team
 * @since 1.0.0
 */
public final class ScoreResultRequests {

    private ScoreResultRequests() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 단건 저장.
     *
     * @param item 저장할 LogItem
     */
    public record Create(LogItem item) implements GatewayRequest<PersistedRecord> {

        public Create {
            if (item == null) {
                throw new IllegalArgumentException("item cannot be null");
            }
        }

        @Override
        public Operation operation() {
            return Operation.CREATE_SCORE_RESULT;
        }

        @Override
        public PersistedRecord accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }

    /**
     * 다건 일괄 저장. 한 번의 호출로 원자적으로 저장됩니다.
     *
     * @param items 저장할 LogItem 목록 (비어 있으면 안 됨)
     */
    public record BatchCreate(List<LogItem> items) implements GatewayRequest<List<PersistedRecord>> {

        public BatchCreate {
            if (items == null || items.isEmpty()) {
                throw new IllegalArgumentException("items cannot be null or empty");
            }
            items = List.copyOf(items);
        }

        @Override
        public Operation operation() {
            return Operation.BATCH_CREATE_SCORE_RESULTS;
        }

        @Override
        public List<PersistedRecord> accept(GatewayRequestHandler handler) {
            return handler.handle(this);
        }
    }
}
