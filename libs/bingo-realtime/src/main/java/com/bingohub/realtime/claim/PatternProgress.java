package com.bingohub.realtime.claim;

/**
 * 图案完成度。
 *
 * @param complete   是否已完成
 * @param toGo       至少还需要叫出的号码数
 * @param attainable 票面结构上能否完成（例如两行票面无法完成三行）
 */
public record PatternProgress(boolean complete, int toGo, boolean attainable) {

    static PatternProgress of(int toGo) {
        return new PatternProgress(toGo == 0, toGo, true);
    }

    static PatternProgress unattainable() {
        return new PatternProgress(false, Integer.MAX_VALUE, false);
    }
}
