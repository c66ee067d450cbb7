package com.example.cleanersched.common.error;

import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedDeque;

/**
 * 直近の内部エラー（検出処理の失敗、検証のフェイルオープンなど）を保持するリングバッファ。
 * 管理APIから参照する。
 */
@Component
public class ErrorLogBuffer {
    private final Deque<Entry> deque = new ConcurrentLinkedDeque<>();
    private final int max = 200;

    public void addError(String source, String message, Throwable t) {
        String s = source == null ? "" : source;
        String m = message == null ? "" : message;
        String detail = t == null ? "" : (t.getClass().getName() + ": " + String.valueOf(t.getMessage()));
        deque.addFirst(new Entry(LocalDateTime.now(), s, m, detail));
        while (deque.size() > max) deque.removeLast();
    }

    public List<Entry> recent() {
        return new ArrayList<>(deque);
    }

    public void clear() {
        deque.clear();
    }

    public record Entry(LocalDateTime time, String source, String message, String detail) {}
}
