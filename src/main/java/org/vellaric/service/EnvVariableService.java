package org.vellaric.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.vellaric.dao.mapper.EnvVariableMapper;
import org.vellaric.dto.EnvVariableRequest;
import org.vellaric.entity.EnvVariable;
import org.vellaric.exception.InvalidRequestException;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * 项目分支级环境变量存储
 */
@Slf4j
@Service
public class EnvVariableService {
    
    public static final String MASK = "••••••••";
    
    private static final Pattern KEY_PATTERN = Pattern.compile("^[A-Z_][A-Z0-9_]*$", Pattern.CASE_INSENSITIVE);
    
    private final EnvVariableMapper envVariableMapper;
    
    public EnvVariableService(EnvVariableMapper envVariableMapper) {
        this.envVariableMapper = envVariableMapper;
    }
    
    /**
     * 部署时使用的键值对（明文）
     */
    public Map<String, String> getVariables(String projectName, String branch) {
        return listVariables(projectName, branch).stream()
            .collect(Collectors.toMap(EnvVariable::getVarKey,
                v -> v.getVarValue() == null ? "" : v.getVarValue(),
                (a, b) -> b, LinkedHashMap::new));
    }
    
    public List<EnvVariable> listVariables(String projectName, String branch) {
        LambdaQueryWrapper<EnvVariable> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(EnvVariable::getProjectName, projectName)
                    .eq(EnvVariable::getBranch, branch)
                    .orderByAsc(EnvVariable::getVarKey);
        return envVariableMapper.selectList(queryWrapper);
    }
    
    /**
     * 对外展示用，敏感值打码
     */
    public List<EnvVariable> listMasked(String projectName, String branch) {
        List<EnvVariable> variables;
        if (branch == null) {
            LambdaQueryWrapper<EnvVariable> queryWrapper = new LambdaQueryWrapper<>();
            queryWrapper.eq(EnvVariable::getProjectName, projectName)
                        .orderByAsc(EnvVariable::getBranch)
                        .orderByAsc(EnvVariable::getVarKey);
            variables = envVariableMapper.selectList(queryWrapper);
        } else {
            variables = listVariables(projectName, branch);
        }
        variables.stream()
            .filter(v -> Boolean.TRUE.equals(v.getSecret()))
            .forEach(v -> v.setVarValue(MASK));
        return variables;
    }
    
    /**
     * 新增或更新 (项目, 分支, 键)
     */
    @Transactional(rollbackFor = Exception.class)
    public EnvVariable save(EnvVariableRequest request) {
        if (!StringUtils.hasText(request.getProjectName()) || !StringUtils.hasText(request.getBranch())
                || !StringUtils.hasText(request.getKey()) || request.getValue() == null) {
            throw new InvalidRequestException("缺少必填字段: projectName, branch, key, value");
        }
        if (!KEY_PATTERN.matcher(request.getKey()).matches()) {
            throw new InvalidRequestException("变量名格式不合法，只能包含字母、数字和下划线: " + request.getKey());
        }
        
        LambdaQueryWrapper<EnvVariable> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(EnvVariable::getProjectName, request.getProjectName())
                    .eq(EnvVariable::getBranch, request.getBranch())
                    .eq(EnvVariable::getVarKey, request.getKey());
        EnvVariable variable = envVariableMapper.selectOne(queryWrapper);
        
        LocalDateTime now = LocalDateTime.now();
        if (variable == null) {
            variable = new EnvVariable();
            variable.setProjectName(request.getProjectName());
            variable.setBranch(request.getBranch());
            variable.setVarKey(request.getKey());
            variable.setCreatedAt(now);
        }
        variable.setVarValue(request.getValue());
        variable.setSecret(request.isSecret());
        variable.setDescription(request.getDescription() == null ? "" : request.getDescription());
        variable.setUpdatedAt(now);
        
        if (variable.getId() == null) {
            envVariableMapper.insert(variable);
        } else {
            envVariableMapper.updateById(variable);
        }
        log.info("保存环境变量: {}/{}/{}", request.getProjectName(), request.getBranch(), request.getKey());
        return variable;
    }
    
    public boolean delete(Long id) {
        boolean deleted = envVariableMapper.deleteById(id) > 0;
        if (deleted) {
            log.info("删除环境变量: {}", id);
        }
        return deleted;
    }
}
