package com.wangbin.sentinel.core.source.wifi;

import com.wangbin.sentinel.common.exception.SourceException;
import com.wangbin.sentinel.common.web.result.ResultCode;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.TimeUnit;

/**
 * 基于 {@link ProcessBuilder} 的命令执行，stderr 合并到输出中。
 */
@Slf4j
public class ProcessCommandRunner implements CommandRunner {

    @Override
    public String run(long timeoutMillis, String... command) {
        String name = String.join(" ", command);
        Process process;
        try {
            process = new ProcessBuilder(command).redirectErrorStream(true).start();
        } catch (IOException e) {
            throw new SourceException(ResultCode.SCAN_ERROR, "wifi-scan", "命令启动失败: " + name, e);
        }

        try {
            if (!process.waitFor(timeoutMillis, TimeUnit.MILLISECONDS)) {
                process.destroyForcibly();
                throw SourceException.timeout(name, timeoutMillis);
            }
            String output;
            try (InputStream in = process.getInputStream()) {
                output = new String(in.readAllBytes(), StandardCharsets.UTF_8);
            }
            if (process.exitValue() != 0) {
                throw SourceException.scan(name + " 退出码 " + process.exitValue() + ": " + abbreviate(output));
            }
            return output;
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw SourceException.scan(name + " 被中断");
        } catch (IOException e) {
            throw new SourceException(ResultCode.SCAN_ERROR, "wifi-scan", "读取命令输出失败: " + name, e);
        }
    }

    private static String abbreviate(String text) {
        String trimmed = text.trim();
        return trimmed.length() > 200 ? trimmed.substring(0, 200) + "..." : trimmed;
    }
}
