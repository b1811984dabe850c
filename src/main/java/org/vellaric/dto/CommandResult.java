package org.vellaric.dto;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.util.Arrays;

/**
 * 外部命令执行结果（标准输出与错误输出合并）
 */
@Data
@AllArgsConstructor
public class CommandResult {
    
    private int exitCode;
    
    private String output;
    
    public boolean isSuccess() {
        return exitCode == 0;
    }
    
    /**
     * 输出的最后几行
     */
    public String tail(int lines) {
        if (output == null || output.isEmpty()) {
            return "";
        }
        String[] all = output.split("\n");
        int from = Math.max(0, all.length - lines);
        return String.join("\n", Arrays.copyOfRange(all, from, all.length));
    }
}
