package org.vellaric.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.vellaric.config.DeployProperties;
import org.vellaric.config.GitProperties;
import org.vellaric.dto.CommandResult;
import org.vellaric.dto.DeploymentRequest;
import org.vellaric.exception.MissingBuildFileException;
import org.vellaric.exception.PlatformException;
import org.vellaric.exception.SourceFetchException;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 文件管理服务：源码工作区、Dockerfile、.env 文件与存储目录
 */
@Slf4j
@Service
public class FileManagerService {
    
    public static final String BUILD_FILE = "Dockerfile";
    
    public static final String ENV_DEFAULTS_FILE = ".env";
    
    private static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rw-------");
    
    private static final Pattern EXPOSE_PATTERN = Pattern.compile("EXPOSE\\s+(\\d+)", Pattern.CASE_INSENSITIVE);
    
    private final DeployProperties deployProperties;
    
    private final GitProperties gitProperties;
    
    private final ProcessRunner processRunner;
    
    public FileManagerService(DeployProperties deployProperties,
                              GitProperties gitProperties,
                              ProcessRunner processRunner) {
        this.deployProperties = deployProperties;
        this.gitProperties = gitProperties;
        this.processRunner = processRunner;
    }
    
    /**
     * 工作区按项目和分支区分，不同分支的构建互不干扰
     */
    public Path workspaceFor(String projectName, String branch) {
        return Paths.get(deployProperties.getBasePath(),
            DeploymentNaming.slug(projectName), DeploymentNaming.branchSegment(branch));
    }
    
    /**
     * 首次部署 clone，之后 fetch + reset 到远端分支
     */
    public Path materializeSource(DeploymentRequest request) {
        Path workspace = workspaceFor(request.getProjectName(), request.getBranch());
        String branch = request.getBranch();
        
        if (Files.isDirectory(workspace.resolve(".git"))) {
            log.info("更新仓库: {} ({})", workspace, branch);
            git(workspace, "拉取失败", "git", "fetch", "origin");
            git(workspace, "切换分支失败", "git", "checkout", branch);
            git(workspace, "重置分支失败", "git", "reset", "--hard", "origin/" + branch);
        } else {
            log.info("克隆仓库: {} -> {}", maskCredentials(request.getRepoUrl()), workspace);
            try {
                Files.createDirectories(workspace.getParent());
            } catch (IOException e) {
                throw new SourceFetchException("创建工作区目录失败: " + workspace, e);
            }
            String cloneUrl = withAccessToken(request.getRepoUrl());
            CommandResult result = processRunner.run(
                Arrays.asList("git", "clone", "--branch", branch, cloneUrl, workspace.toString()), null);
            if (!result.isSuccess()) {
                throw new SourceFetchException("克隆仓库失败: " + maskCredentials(result.getOutput()));
            }
        }
        return workspace;
    }
    
    private void git(Path workspace, String failure, String... command) {
        CommandResult result = processRunner.run(Arrays.asList(command), workspace);
        if (!result.isSuccess()) {
            throw new SourceFetchException(failure + ": " + maskCredentials(result.getOutput()));
        }
    }
    
    /**
     * 为 http(s) 仓库地址注入访问令牌，SSH 地址保持不变
     */
    String withAccessToken(String repoUrl) {
        String token = gitProperties.getAccessToken();
        if (!StringUtils.hasText(token) || repoUrl == null) {
            return repoUrl;
        }
        for (String scheme : new String[] {"https://", "http://"}) {
            if (repoUrl.startsWith(scheme) && !repoUrl.substring(scheme.length()).contains("@")) {
                return scheme + "oauth2:" + token + "@" + repoUrl.substring(scheme.length());
            }
        }
        return repoUrl;
    }
    
    String maskCredentials(String text) {
        if (text == null) {
            return null;
        }
        String masked = text.replaceAll("://[^/@\\s]+@", "://***@");
        String token = gitProperties.getAccessToken();
        if (StringUtils.hasText(token)) {
            masked = masked.replace(token, "***");
        }
        return masked;
    }
    
    /**
     * 仓库中必须存在 Dockerfile
     */
    public Path requireBuildFile(Path workspace) {
        Path dockerfile = workspace.resolve(BUILD_FILE);
        if (!Files.isRegularFile(dockerfile)) {
            throw new MissingBuildFileException(workspace.toString());
        }
        return dockerfile;
    }
    
    /**
     * 读取第一个 EXPOSE 指令的端口，没有时使用默认端口
     */
    public int detectExposedPort(Path dockerfile) {
        try {
            String content = new String(Files.readAllBytes(dockerfile), StandardCharsets.UTF_8);
            Matcher matcher = EXPOSE_PATTERN.matcher(content);
            if (matcher.find()) {
                return Integer.parseInt(matcher.group(1));
            }
        } catch (IOException e) {
            log.warn("读取 Dockerfile 失败: {}", dockerfile, e);
        }
        log.warn("Dockerfile 未声明 EXPOSE，使用默认端口 {}", deployProperties.getDefaultAppPort());
        return deployProperties.getDefaultAppPort();
    }
    
    /**
     * 读取仓库自带的 .env 默认值，文件不存在时返回空
     */
    public Map<String, String> readEnvDefaults(Path workspace) {
        Path envFile = workspace.resolve(ENV_DEFAULTS_FILE);
        if (!Files.isRegularFile(envFile)) {
            return new LinkedHashMap<>();
        }
        try {
            return parseEnvLines(Files.readAllLines(envFile, StandardCharsets.UTF_8));
        } catch (IOException e) {
            log.warn("读取 .env 文件失败，忽略: {}", envFile, e);
            return new LinkedHashMap<>();
        }
    }
    
    /**
     * KEY=VALUE 格式；忽略空行和 # 注释，去掉 export 前缀与成对引号
     */
    static Map<String, String> parseEnvLines(List<String> lines) {
        Map<String, String> vars = new LinkedHashMap<>();
        for (String raw : lines) {
            String line = raw.trim();
            if (line.isEmpty() || line.startsWith("#")) {
                continue;
            }
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }
            int eq = line.indexOf('=');
            if (eq <= 0) {
                continue;
            }
            String key = line.substring(0, eq).trim();
            String value = line.substring(eq + 1).trim();
            if (value.length() >= 2
                    && ((value.startsWith("\"") && value.endsWith("\""))
                    || (value.startsWith("'") && value.endsWith("'")))) {
                value = value.substring(1, value.length() - 1);
            }
            vars.put(key, value);
        }
        return vars;
    }
    
    /**
     * 写入供 docker run --env-file 使用的临时文件，支持 POSIX 权限时仅所有者可读写
     */
    public Path writeEnvFile(String containerName, Map<String, String> env) {
        Path envFile = Paths.get(System.getProperty("java.io.tmpdir"), containerName + ".env");
        try {
            Files.deleteIfExists(envFile);
            if (FileSystems.getDefault().supportedFileAttributeViews().contains("posix")) {
                Files.createFile(envFile, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                Files.createFile(envFile);
            }
        } catch (IOException e) {
            throw new PlatformException("ENV_FILE_WRITE_FAILED", "创建环境变量文件失败: " + envFile, e);
        }
        try (BufferedWriter writer = Files.newBufferedWriter(envFile, StandardCharsets.UTF_8)) {
            for (Map.Entry<String, String> entry : env.entrySet()) {
                String value = entry.getValue() == null ? "" : entry.getValue().replace("\n", "\\n");
                writer.write(entry.getKey() + "=" + value);
                writer.newLine();
            }
        } catch (IOException e) {
            throw new PlatformException("ENV_FILE_WRITE_FAILED", "写入环境变量文件失败: " + envFile, e);
        }
        return envFile;
    }
    
    public void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("删除临时文件失败: {}", file, e);
        }
    }
    
    public Path createDirectories(Path directory) {
        try {
            return Files.createDirectories(directory);
        } catch (IOException e) {
            throw new PlatformException("DIRECTORY_CREATE_FAILED", "创建目录失败: " + directory, e);
        }
    }
    
    /**
     * 递归删除目录
     */
    public void deleteDirectory(Path directory) {
        if (!Files.exists(directory)) {
            log.info("目录不存在，跳过删除: {}", directory);
            return;
        }
        try {
            Files.walkFileTree(directory, new SimpleFileVisitor<Path>() {
                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
                    Files.delete(file);
                    return FileVisitResult.CONTINUE;
                }
                
                @Override
                public FileVisitResult postVisitDirectory(Path dir, IOException exc) throws IOException {
                    if (exc != null) {
                        throw exc;
                    }
                    Files.delete(dir);
                    return FileVisitResult.CONTINUE;
                }
            });
            log.info("删除目录成功: {}", directory);
        } catch (IOException e) {
            log.error("删除目录失败: {}", directory, e);
            throw new PlatformException("DIRECTORY_DELETE_FAILED", "删除目录失败: " + directory, e);
        }
    }
}
