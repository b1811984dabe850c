package org.vellaric.provider;

import org.vellaric.exception.CertificateIssueException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

public class FakeCertificateAuthority implements CertificateAuthority {

    private final Set<String> certificates = new HashSet<>();

    private final List<String> issued = new ArrayList<>();

    private final List<String> renewed = new ArrayList<>();

    private String failure;

    public void fail(String failure) {
        this.failure = failure;
    }

    public List<String> getIssued() {
        return issued;
    }

    public List<String> getRenewed() {
        return renewed;
    }

    @Override
    public boolean certificateExists(String domain) {
        return certificates.contains(domain);
    }

    @Override
    public void issue(String domain) {
        if (failure != null) {
            throw new CertificateIssueException(failure);
        }
        issued.add(domain);
        certificates.add(domain);
    }

    @Override
    public void renew(String domain) {
        if (failure != null) {
            throw new CertificateIssueException(failure);
        }
        renewed.add(domain);
    }
}
