package com.wangbin.sentinel.core.source.snmp;

import org.snmp4j.smi.Counter32;
import org.snmp4j.smi.Counter64;
import org.snmp4j.smi.Gauge32;
import org.snmp4j.smi.Integer32;
import org.snmp4j.smi.Null;
import org.snmp4j.smi.OID;
import org.snmp4j.smi.OctetString;
import org.snmp4j.smi.TimeTicks;
import org.snmp4j.smi.Variable;

import java.util.Locale;

/**
 * SNMP 变量转换工具方法。
 */
public final class SnmpValues {

    private SnmpValues() {
    }

    /**
     * 取 OID 最后 count 段组成点分字符串，例如 ARP 表索引中的 IP
     */
    public static String lastSubIds(OID oid, int count) {
        if (oid == null || oid.size() < count) {
            return null;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = oid.size() - count; i < oid.size(); i++) {
            if (builder.length() > 0) {
                builder.append('.');
            }
            builder.append(oid.get(i));
        }
        return builder.toString();
    }

    public static long toLong(Variable variable) {
        if (variable == null || variable instanceof Null) {
            return 0L;
        }
        if (variable instanceof Counter64 counter64) {
            return counter64.getValue();
        }
        if (variable instanceof Counter32 counter32) {
            return counter32.getValue();
        }
        if (variable instanceof Gauge32 gauge32) {
            return gauge32.getValue();
        }
        if (variable instanceof TimeTicks timeTicks) {
            return timeTicks.getValue();
        }
        if (variable instanceof Integer32 int32) {
            return int32.getValue();
        }
        try {
            return Long.parseLong(variable.toString().trim());
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * 物理地址转大写冒号分隔格式
     */
    public static String toMac(Variable variable) {
        if (variable == null || variable instanceof Null) {
            return null;
        }
        if (variable instanceof OctetString octets && octets.length() == 6) {
            return octets.toHexString(':').toUpperCase(Locale.ROOT);
        }
        return variable.toString().toUpperCase(Locale.ROOT);
    }

    public static String toText(Variable variable) {
        if (variable == null || variable instanceof Null) {
            return "";
        }
        if (variable instanceof OctetString octets) {
            return octets.toString();
        }
        return variable.toString();
    }
}
