package org.vellaric.provider;

/**
 * 证书签发接口
 */
public interface CertificateAuthority {
    
    boolean certificateExists(String domain);
    
    /**
     * 签发证书并安装到反向代理；证书已存在且未临期时只重新安装
     *
     * @throws org.vellaric.exception.CertificateIssueException 签发失败
     */
    void issue(String domain);
    
    /**
     * @throws org.vellaric.exception.CertificateIssueException 续期失败
     */
    void renew(String domain);
}
