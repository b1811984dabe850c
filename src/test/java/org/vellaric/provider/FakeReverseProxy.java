package org.vellaric.provider;

import org.vellaric.exception.ProxyConfigException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class FakeReverseProxy implements ReverseProxy {

    private final Map<String, Integer> sites = new LinkedHashMap<>();

    private final List<String> operations = new ArrayList<>();

    private boolean failWrite;

    public void failWrite() {
        this.failWrite = true;
    }

    public Map<String, Integer> getSites() {
        return sites;
    }

    public List<String> getOperations() {
        return operations;
    }

    @Override
    public void writeSite(String domain, int port, String containerName) {
        if (failWrite) {
            throw new ProxyConfigException("nginx 配置校验失败: " + domain);
        }
        operations.add("write " + domain);
        sites.put(domain, port);
    }

    @Override
    public boolean siteExists(String domain) {
        return sites.containsKey(domain);
    }

    @Override
    public void removeSite(String domain) {
        operations.add("remove " + domain);
        sites.remove(domain);
    }

    @Override
    public void reload() {
        operations.add("reload");
    }
}
