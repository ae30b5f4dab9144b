package com.ryuqq.conductor.core.delegation;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 루트 WorkUnit 하위 트리 전체에 전파되는 취소 신호.
 *
 * <p>한 번 발생하면 되돌릴 수 없습니다. 리스너는 신호 발생 시 한 번 호출되며,
 * 이미 취소된 뒤에 등록된 리스너는 즉시 호출됩니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class CancellationSignal {

    private final AtomicReference<String> reason = new AtomicReference<>();
    private final List<Runnable> listeners = new CopyOnWriteArrayList<>();

    /**
     * 취소 신호 발생.
     *
     * @param cancelReason 취소 사유
     * @return 이번 호출이 처음 취소한 경우 true
     */
    public boolean cancel(String cancelReason) {
        String value = cancelReason == null || cancelReason.isBlank() ? "cancelled" : cancelReason;
        if (!reason.compareAndSet(null, value)) {
            return false;
        }
        for (Runnable listener : listeners) {
            if (listeners.remove(listener)) {
                listener.run();
            }
        }
        return true;
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    public String getReason() {
        return reason.get();
    }

    /**
     * 취소 리스너 등록.
     *
     * @param listener 취소 시 실행할 작업
     */
    public void onCancel(Runnable listener) {
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        listeners.add(listener);
        if (isCancelled() && listeners.remove(listener)) {
            listener.run();
        }
    }

    public void removeListener(Runnable listener) {
        listeners.remove(listener);
    }
}
