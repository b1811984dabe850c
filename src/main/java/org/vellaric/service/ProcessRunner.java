package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.vellaric.dto.CommandResult;
import org.vellaric.exception.ProcessExecutionException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * 外部命令执行（docker / git / nginx / certbot / dig）
 */
@Slf4j
@Service
public class ProcessRunner {
    
    private static final long DEFAULT_TIMEOUT_MINUTES = 30;
    
    public CommandResult run(String... command) {
        return run(Arrays.asList(command), null);
    }
    
    public CommandResult run(List<String> command, Path workDir) {
        return run(command, workDir, command.get(0), DEFAULT_TIMEOUT_MINUTES, TimeUnit.MINUTES);
    }
    
    /**
     * 执行命令并逐行记录输出，标准错误合并到标准输出。
     * 非零退出码不抛异常，由调用方判断
     *
     * @param logPrefix 日志前缀，如 "Docker"、"Git"
     */
    public CommandResult run(List<String> command, Path workDir, String logPrefix, long timeout, TimeUnit unit) {
        log.debug("执行命令: {}", describe(command));
        ProcessBuilder processBuilder = new ProcessBuilder(command);
        if (workDir != null) {
            processBuilder.directory(workDir.toFile());
        }
        processBuilder.redirectErrorStream(true);
        
        Process process = null;
        try {
            process = processBuilder.start();
            
            StringBuilder output = new StringBuilder();
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append("\n");
                    log.info("{}: {}", logPrefix, line);
                }
            }
            
            if (!process.waitFor(timeout, unit)) {
                process.destroyForcibly();
                throw new ProcessExecutionException("命令执行超时: " + command.get(0), null);
            }
            
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                log.debug("命令退出码: {}, command={}", exitCode, command.get(0));
            }
            return new CommandResult(exitCode, output.toString().trim());
        } catch (IOException e) {
            throw new ProcessExecutionException("执行命令失败: " + command.get(0), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            throw new ProcessExecutionException("命令执行被中断: " + command.get(0), e);
        }
    }
    
    /**
     * 只记录命令和子命令，参数里可能有密码
     */
    private String describe(List<String> command) {
        return command.size() > 1 ? command.get(0) + " " + command.get(1) : command.get(0);
    }
}
