package com.bingohub.realtime.claim;

/**
 * 票面格子坐标（从 0 开始）。
 */
public record CellPosition(int row, int col) {
}
