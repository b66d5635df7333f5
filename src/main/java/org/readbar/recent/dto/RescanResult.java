package org.readbar.recent.dto;

import java.util.List;

/**
 * {@code readbar_rescan} 的返回结果。
 *
 * @param scannedRoots   成功扫描的根目录 id
 * @param skippedRoots   被跳过的根目录 id（不存在、不可读或遍历出错）
 * @param candidateCount 收集到的候选文件数
 * @param fedCount       写入最近文件集合的条目数
 * @param visibleCount   扫描后视图中的条目数
 */
public record RescanResult(
        List<String> scannedRoots,
        List<String> skippedRoots,
        int candidateCount,
        int fedCount,
        int visibleCount
) {
}
