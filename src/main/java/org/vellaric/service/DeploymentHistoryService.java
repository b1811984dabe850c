package org.vellaric.service;

import com.baomidou.mybatisplus.core.conditions.query.LambdaQueryWrapper;
import com.baomidou.mybatisplus.core.conditions.update.LambdaUpdateWrapper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;
import org.vellaric.dao.mapper.DeploymentMapper;
import org.vellaric.dto.DeploymentInfo;
import org.vellaric.dto.DeploymentStatusEvent;
import org.vellaric.dto.DomainBinding;
import org.vellaric.dto.enums.DeploymentStatus;
import org.vellaric.entity.Deployment;

import java.time.LocalDateTime;
import java.util.List;
import java.util.stream.Collectors;

/**
 * 部署历史持久化（作为状态监听器写库）
 */
@Slf4j
@Service
public class DeploymentHistoryService implements DeploymentStatusListener {
    
    private final DeploymentMapper deploymentMapper;
    
    private final LocalDateTime serviceStartedAt = LocalDateTime.now();
    
    public DeploymentHistoryService(DeploymentMapper deploymentMapper) {
        this.deploymentMapper = deploymentMapper;
    }
    
    @Override
    public void onStatusChange(DeploymentStatusEvent event) {
        DeploymentInfo info = event.getDeployment();
        if (info == null) {
            return;
        }
        Deployment deployment = toEntity(info);
        if (deploymentMapper.selectById(info.getId()) == null) {
            deploymentMapper.insert(deployment);
        } else {
            deploymentMapper.updateById(deployment);
        }
        log.debug("部署历史已更新: {} -> {}", info.getId(), info.getStatus());
    }
    
    public Deployment getDeployment(String id) {
        return deploymentMapper.selectById(id);
    }
    
    /**
     * (项目, 分支) 最近一次成功的部署
     */
    public Deployment findLatestSuccessful(String projectName, String branch) {
        LambdaQueryWrapper<Deployment> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.eq(Deployment::getProjectName, projectName)
                    .eq(Deployment::getBranch, branch)
                    .eq(Deployment::getStatus, DeploymentStatus.SUCCESS)
                    .orderByDesc(Deployment::getDeployedAt)
                    .last("LIMIT 1");
        return deploymentMapper.selectOne(queryWrapper);
    }
    
    public void updateCertificate(String id, DomainBinding binding) {
        LambdaUpdateWrapper<Deployment> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.eq(Deployment::getId, id)
                     .set(Deployment::getCertificateState, binding.getCertificateState())
                     .set(Deployment::getCertificateError, binding.getCertificateError())
                     .set(Deployment::getUpdatedAt, LocalDateTime.now());
        deploymentMapper.update(null, updateWrapper);
    }
    
    public List<DeploymentInfo> listRecent(int limit) {
        LambdaQueryWrapper<Deployment> queryWrapper = new LambdaQueryWrapper<>();
        queryWrapper.orderByDesc(Deployment::getQueuedAt);
        Page<Deployment> page = deploymentMapper.selectPage(new Page<>(1, Math.max(1, limit)), queryWrapper);
        return page.getRecords().stream().map(DeploymentHistoryService::toInfo).collect(Collectors.toList());
    }
    
    /**
     * 队列只在内存中，服务重启后仍处于 queued / building 的记录已无执行者
     */
    @EventListener(ApplicationReadyEvent.class)
    public void failInterruptedDeployments() {
        LambdaUpdateWrapper<Deployment> updateWrapper = new LambdaUpdateWrapper<>();
        updateWrapper.in(Deployment::getStatus, DeploymentStatus.QUEUED, DeploymentStatus.BUILDING)
                     .lt(Deployment::getQueuedAt, serviceStartedAt)
                     .set(Deployment::getStatus, DeploymentStatus.FAILED)
                     .set(Deployment::getErrorMessage, "服务重启，部署中断")
                     .set(Deployment::getFailedAt, LocalDateTime.now())
                     .set(Deployment::getUpdatedAt, LocalDateTime.now());
        int updated = deploymentMapper.update(null, updateWrapper);
        if (updated > 0) {
            log.warn("{} 个未完成的部署因服务重启被标记为失败", updated);
        }
    }
    
    static Deployment toEntity(DeploymentInfo info) {
        Deployment deployment = new Deployment();
        deployment.setId(info.getId());
        deployment.setProjectName(info.getProjectName());
        deployment.setBranch(info.getBranch());
        deployment.setCommitId(info.getCommit());
        deployment.setCommitMessage(info.getCommitMessage());
        deployment.setRepoUrl(info.getRepoUrl());
        deployment.setAuthor(info.getAuthor());
        deployment.setStatus(info.getStatus());
        deployment.setPort(info.getPort());
        deployment.setContainerName(info.getContainerName());
        deployment.setDomain(info.getDomain());
        deployment.setCertificateState(info.getCertificateState());
        deployment.setCertificateError(info.getCertificateError());
        deployment.setErrorMessage(info.getError());
        deployment.setQueuedAt(info.getQueuedAt());
        deployment.setStartedAt(info.getStartedAt());
        deployment.setDeployedAt(info.getDeployedAt());
        deployment.setFailedAt(info.getFailedAt());
        deployment.setUpdatedAt(LocalDateTime.now());
        return deployment;
    }
    
    public static DeploymentInfo toInfo(Deployment deployment) {
        DeploymentInfo info = new DeploymentInfo();
        info.setId(deployment.getId());
        info.setProjectName(deployment.getProjectName());
        info.setBranch(deployment.getBranch());
        info.setCommit(deployment.getCommitId());
        info.setCommitMessage(deployment.getCommitMessage());
        info.setRepoUrl(deployment.getRepoUrl());
        info.setAuthor(deployment.getAuthor());
        info.setStatus(deployment.getStatus());
        info.setPort(deployment.getPort());
        info.setContainerName(deployment.getContainerName());
        info.setDomain(deployment.getDomain());
        info.setCertificateState(deployment.getCertificateState());
        info.setCertificateError(deployment.getCertificateError());
        info.setError(deployment.getErrorMessage());
        info.setQueuedAt(deployment.getQueuedAt());
        info.setStartedAt(deployment.getStartedAt());
        info.setDeployedAt(deployment.getDeployedAt());
        info.setFailedAt(deployment.getFailedAt());
        return info;
    }
}
