package com.wangbin.sentinel.core.source.snmp;

import com.wangbin.sentinel.common.exception.SourceException;
import com.wangbin.sentinel.core.config.SentinelProperties;
import lombok.extern.slf4j.Slf4j;
import org.snmp4j.CommunityTarget;
import org.snmp4j.PDU;
import org.snmp4j.Snmp;
import org.snmp4j.Target;
import org.snmp4j.TransportMapping;
import org.snmp4j.mp.SnmpConstants;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.UdpAddress;
import org.snmp4j.smi.VariableBinding;
import org.snmp4j.transport.DefaultUdpTransportMapping;
import org.snmp4j.util.DefaultPDUFactory;
import org.snmp4j.util.TreeEvent;
import org.snmp4j.util.TreeUtils;

import java.io.Closeable;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * 路由器 SNMP 会话，首次使用时建立，按子树 walk。
 */
@Slf4j
public class SnmpClient implements SnmpWalker, Closeable {

    private final SentinelProperties.SnmpConfig config;

    private Snmp snmp;
    private TransportMapping<UdpAddress> transport;
    private Target<UdpAddress> target;

    public SnmpClient(SentinelProperties.SnmpConfig config) {
        this.config = config;
    }

    @Override
    public synchronized List<VariableBinding> walk(String rootOid) {
        ensureOpen();
        TreeUtils treeUtils = new TreeUtils(snmp, new DefaultPDUFactory(PDU.GETNEXT));
        List<TreeEvent> events = treeUtils.getSubtree(target, new OID(rootOid));

        List<VariableBinding> bindings = new ArrayList<>();
        if (events == null) {
            return bindings;
        }
        for (TreeEvent event : events) {
            if (event == null) {
                continue;
            }
            if (event.isError()) {
                throw SourceException.snmp("snmp:" + config.getHost(),
                        "SNMP walk " + rootOid + " 失败: " + event.getErrorMessage(), event.getException());
            }
            VariableBinding[] vbs = event.getVariableBindings();
            if (vbs == null) {
                continue;
            }
            for (VariableBinding vb : vbs) {
                if (vb != null) {
                    bindings.add(vb);
                }
            }
        }
        return bindings;
    }

    @Override
    public synchronized void close() {
        if (snmp != null) {
            try {
                snmp.close();
            } catch (IOException e) {
                log.warn("关闭 SNMP 会话异常", e);
            } finally {
                snmp = null;
            }
        }
        if (transport != null) {
            try {
                transport.close();
            } catch (IOException e) {
                log.warn("关闭 SNMP 传输异常", e);
            } finally {
                transport = null;
            }
        }
        target = null;
    }

    private void ensureOpen() {
        if (snmp != null) {
            return;
        }
        try {
            transport = new DefaultUdpTransportMapping();
            transport.listen();
            snmp = new Snmp(transport);
            target = buildTarget();
            log.info("SNMP 会话已建立 host={} port={}", config.getHost(), config.getPort());
        } catch (IOException e) {
            close();
            throw SourceException.snmp("snmp:" + config.getHost(), "SNMP 会话建立失败", e);
        }
    }

    private Target<UdpAddress> buildTarget() {
        CommunityTarget<UdpAddress> communityTarget = new CommunityTarget<>();
        communityTarget.setCommunity(new OctetString(config.getCommunity()));
        communityTarget.setVersion(parseVersion(config.getVersion()));
        communityTarget.setRetries(Math.max(0, config.getRetries()));
        communityTarget.setTimeout(config.getTimeoutMs() > 0 ? config.getTimeoutMs() : 5000);
        String host = config.getHost() != null ? config.getHost() : "127.0.0.1";
        communityTarget.setAddress(new UdpAddress(host + "/" + config.getPort()));
        return communityTarget;
    }

    static int parseVersion(String versionText) {
        if (versionText == null) {
            return SnmpConstants.version2c;
        }
        return switch (versionText.trim()) {
            case "1", "v1" -> SnmpConstants.version1;
            // v3 需要 USM 安全参数，这里只支持社区字符串方式
            default -> SnmpConstants.version2c;
        };
    }
}
