package com.wangbin.sentinel.core.source.snmp;

import org.snmp4j.smi.VariableBinding;

import java.util.List;

/**
 * 对一个 OID 子树做 walk。
 */
@FunctionalInterface
public interface SnmpWalker {

    List<VariableBinding> walk(String rootOid);
}
