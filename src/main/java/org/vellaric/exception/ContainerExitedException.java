package org.vellaric.exception;

/**
 * 容器在就绪之前退出，携带最后的容器日志
 */
public class ContainerExitedException extends HealthTimeoutException {
    
    public static final String ERROR_CODE = "CONTAINER_EXITED";
    
    private final String lastLogs;
    
    public ContainerExitedException(String containerName, String lastLogs) {
        super(ERROR_CODE, "容器在就绪前意外停止: " + containerName
            + (lastLogs != null && !lastLogs.isEmpty() ? "\n" + lastLogs : ""));
        this.lastLogs = lastLogs;
    }
    
    public String getLastLogs() {
        return lastLogs;
    }
}
