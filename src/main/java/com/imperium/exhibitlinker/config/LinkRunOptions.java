package com.imperium.exhibitlinker.config;

import com.imperium.exhibitlinker.link.SanitizeStrategy;
import com.imperium.exhibitlinker.model.link.ViewerProfile;
import com.imperium.exhibitlinker.policy.IoRetryPolicy;
import lombok.Builder;
import lombok.Value;

import java.nio.file.Path;
import java.util.List;

/**
 * 单次运行生效的选项：配置默认值叠加请求覆盖后的结果。
 */
@Value
@Builder
public class LinkRunOptions {

    Path exhibitsRoot;

    /** 为 null 时按 outputSuffix 生成 */
    Path outputPath;

    boolean writeOutput;

    boolean sanitizeFilenames;

    SanitizeStrategy sanitizeStrategy;

    boolean dryRun;

    double fuzzyThreshold;

    double fuzzyTieEpsilon;

    int maxPageScanRetries;

    long retryBackoffMs;

    ViewerProfile viewer;

    List<String> batesPrefixes;

    String outputSuffix;

    public IoRetryPolicy retryPolicy() {
        return new IoRetryPolicy(maxPageScanRetries, retryBackoffMs);
    }
}
