package com.bingohub.realtime.sync;

import org.apache.commons.lang3.Validate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * 叫号状态（不可变）。
 *
 * 约束：
 *  - calledNumbers 按叫号顺序排列，同一代内号码唯一、只追加；
 *  - 重置进入新一代（generation + 1）并清空序列；
 *  - updatedAt 单调不减。
 */
public final class CallState {

    private final String sessionId;
    private final List<Integer> calledNumbers;
    private final Integer lastCalledNumber;
    private final long updatedAt;
    private final long generation;
    private final String activePattern;

    public CallState(String sessionId,
                     List<Integer> calledNumbers,
                     Integer lastCalledNumber,
                     long updatedAt,
                     long generation,
                     String activePattern) {
        this.sessionId = Validate.notBlank(sessionId, "sessionId 不能为空");
        List<Integer> numbers = calledNumbers == null ? List.of() : List.copyOf(calledNumbers);
        Validate.isTrue(new LinkedHashSet<>(numbers).size() == numbers.size(), "calledNumbers 存在重复号码");
        Validate.isTrue(generation >= 0, "generation 不能为负数");
        this.calledNumbers = numbers;
        this.lastCalledNumber = lastCalledNumber != null ? lastCalledNumber
                : numbers.isEmpty() ? null : numbers.get(numbers.size() - 1);
        this.updatedAt = updatedAt;
        this.generation = generation;
        this.activePattern = activePattern;
    }

    public static CallState initial(String sessionId) {
        return new CallState(sessionId, List.of(), null, 0L, 0L, null);
    }

    public String sessionId() {
        return sessionId;
    }

    public List<Integer> calledNumbers() {
        return calledNumbers;
    }

    public Integer lastCalledNumber() {
        return lastCalledNumber;
    }

    public long updatedAt() {
        return updatedAt;
    }

    public long generation() {
        return generation;
    }

    public String activePattern() {
        return activePattern;
    }

    public boolean contains(int number) {
        return calledNumbers.contains(number);
    }

    public Set<Integer> calledSet() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(calledNumbers));
    }

    /**
     * 追加一个号码；已存在时返回自身。
     */
    public CallState append(int number, long now) {
        if (contains(number)) {
            return this;
        }
        List<Integer> next = new ArrayList<>(calledNumbers.size() + 1);
        next.addAll(calledNumbers);
        next.add(number);
        return new CallState(sessionId, next, number, Math.max(updatedAt, now), generation, activePattern);
    }

    /**
     * 进入新一代并清空序列，保留当前图案。
     */
    public CallState reset(long now) {
        return new CallState(sessionId, List.of(), null, Math.max(updatedAt, now), generation + 1, activePattern);
    }

    public CallState withPattern(String pattern, long now) {
        return new CallState(sessionId, calledNumbers, lastCalledNumber, Math.max(updatedAt, now), generation, pattern);
    }

    /**
     * 用同一代的完整序列替换（玩家侧收到完整 calledNumbers 时使用）。
     */
    public CallState withNumbers(List<Integer> numbers, long now) {
        return new CallState(sessionId, numbers, null, Math.max(updatedAt, now), generation, activePattern);
    }

    public CallState withGeneration(long nextGeneration, long now) {
        return new CallState(sessionId, List.of(), null, Math.max(updatedAt, now), nextGeneration, activePattern);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CallState that)) {
            return false;
        }
        return updatedAt == that.updatedAt
                && generation == that.generation
                && sessionId.equals(that.sessionId)
                && calledNumbers.equals(that.calledNumbers)
                && Objects.equals(lastCalledNumber, that.lastCalledNumber)
                && Objects.equals(activePattern, that.activePattern);
    }

    @Override
    public int hashCode() {
        return Objects.hash(sessionId, calledNumbers, lastCalledNumber, updatedAt, generation, activePattern);
    }

    @Override
    public String toString() {
        return "CallState{session=" + sessionId + ", gen=" + generation + ", called=" + calledNumbers
                + ", pattern=" + activePattern + "}";
    }
}
