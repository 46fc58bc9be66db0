package com.bingohub.realtime.claim;

/**
 * 声明相关的提示消息常量
 * 统一管理所有玩家可见的提示，避免硬编码
 *
 * 使用示例：
 *   String reason = ClaimMessages.formatToGo(3);
 */
public final class ClaimMessages {

    private ClaimMessages() {
        // 工具类，禁止实例化
    }

    // ========== 校验未通过 ==========

    /** 图案未完成（需要格式化，传入还差的号码数） */
    public static final String PATTERN_INCOMPLETE = "图案尚未完成，还差 %d 个号码";

    /** 图案未开放（需要格式化，传入声明的图案名） */
    public static final String PATTERN_NOT_ACTIVE = "当前图案不是「%s」，该声明无效";

    /** 当前没有开放任何图案 */
    public static final String NO_ACTIVE_PATTERN = "当前没有开放的中奖图案";

    /** 本局已重置 */
    public static final String GAME_RESET = "本局已重置，声明作废";

    /** 声明的局数与叫号方不一致（需要格式化，传入声明局数与当前局数） */
    public static final String GENERATION_MISMATCH = "声明所属局数 %d 与当前局数 %d 不一致";

    /** 票面数据无效 */
    public static final String MALFORMED_TICKET = "票面数据无效";

    /** 票面结构无法完成该图案（需要格式化，传入图案名） */
    public static final String UNREACHABLE = "该票面无法完成「%s」";

    // ========== 判定结果 ==========

    /** 奖项已被判定，迟到的有效声明 */
    public static final String PRIZE_ALREADY_AWARDED = "奖项已判定";

    /** 叫号方驳回（未填写原因时使用） */
    public static final String CALLER_REJECTED = "叫号方驳回了该声明";

    public static String formatToGo(int toGo) {
        return String.format(PATTERN_INCOMPLETE, toGo);
    }

    public static String formatPatternNotActive(String patternName) {
        return String.format(PATTERN_NOT_ACTIVE, patternName);
    }

    public static String formatGenerationMismatch(long claimed, long current) {
        return String.format(GENERATION_MISMATCH, claimed, current);
    }

    public static String formatUnreachable(String patternName) {
        return String.format(UNREACHABLE, patternName);
    }
}
