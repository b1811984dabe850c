package org.vellaric.service;

import com.baomidou.mybatisplus.core.MybatisConfiguration;
import com.baomidou.mybatisplus.core.conditions.Wrapper;
import com.baomidou.mybatisplus.core.metadata.TableInfoHelper;
import com.baomidou.mybatisplus.extension.plugins.pagination.Page;
import org.apache.ibatis.builder.MapperBuilderAssistant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.vellaric.dao.mapper.DeploymentMapper;
import org.vellaric.dto.DeploymentInfo;
import org.vellaric.dto.DeploymentStatusEvent;
import org.vellaric.dto.enums.CertificateState;
import org.vellaric.dto.enums.DeploymentStatus;
import org.vellaric.entity.Deployment;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class DeploymentHistoryServiceTest {

    private DeploymentMapper mapper;

    private DeploymentHistoryService history;

    @BeforeAll
    static void initTableInfo() {
        TableInfoHelper.initTableInfo(new MapperBuilderAssistant(new MybatisConfiguration(), ""), Deployment.class);
    }

    @BeforeEach
    void setUp() {
        mapper = mock(DeploymentMapper.class);
        history = new DeploymentHistoryService(mapper);
    }

    private static DeploymentStatusEvent event(DeploymentStatus status) {
        DeploymentInfo info = new DeploymentInfo();
        info.setId("deploy_1_abc");
        info.setProjectName("api");
        info.setBranch("main");
        info.setCommit("abc123");
        info.setStatus(status);
        info.setCertificateState(CertificateState.NONE);
        info.setQueuedAt(LocalDateTime.now());
        return DeploymentStatusEvent.builder()
            .id(info.getId())
            .status(status)
            .deployment(info)
            .timestamp(LocalDateTime.now())
            .build();
    }

    @Test
    @DisplayName("the first event inserts and later events update the same row")
    void upsertsOnStatusChange() {
        history.onStatusChange(event(DeploymentStatus.QUEUED));
        ArgumentCaptor<Deployment> inserted = ArgumentCaptor.forClass(Deployment.class);
        verify(mapper).insert(inserted.capture());
        assertEquals("abc123", inserted.getValue().getCommitId());
        assertEquals(DeploymentStatus.QUEUED, inserted.getValue().getStatus());

        when(mapper.selectById("deploy_1_abc")).thenReturn(inserted.getValue());
        history.onStatusChange(event(DeploymentStatus.BUILDING));

        ArgumentCaptor<Deployment> updated = ArgumentCaptor.forClass(Deployment.class);
        verify(mapper).updateById(updated.capture());
        assertEquals(DeploymentStatus.BUILDING, updated.getValue().getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    void listsRecentDeploymentsNewestFirst() {
        Deployment newer = new Deployment();
        newer.setId("deploy_2");
        newer.setStatus(DeploymentStatus.SUCCESS);
        Deployment older = new Deployment();
        older.setId("deploy_1");
        older.setStatus(DeploymentStatus.FAILED);
        Page<Deployment> page = new Page<>(1, 2);
        page.setRecords(Arrays.asList(newer, older));
        when(mapper.selectPage(any(Page.class), any(Wrapper.class))).thenReturn(page);

        List<DeploymentInfo> recent = history.listRecent(2);

        assertEquals(2, recent.size());
        assertEquals("deploy_2", recent.get(0).getId());
        assertEquals(DeploymentStatus.FAILED, recent.get(1).getStatus());
    }

    @Test
    @SuppressWarnings("unchecked")
    @DisplayName("deployments left unfinished by a restart are marked failed")
    void marksInterruptedDeployments() {
        when(mapper.update(isNull(), any(Wrapper.class))).thenReturn(2);

        history.failInterruptedDeployments();

        verify(mapper).update(isNull(), any(Wrapper.class));
    }

    @Test
    void eventsWithoutSnapshotAreIgnored() {
        history.onStatusChange(DeploymentStatusEvent.builder().id("x").status(DeploymentStatus.QUEUED).build());

        verifyNoInteractions(mapper);
    }
}
