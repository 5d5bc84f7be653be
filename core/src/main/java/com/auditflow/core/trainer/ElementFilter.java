package com.auditflow.core.trainer;

import com.auditflow.core.api.Resettable;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 이미 본 요소(폼/링크) 시그니처 집합. 스캔 간 공유되므로 SharedState 가 reset 한다.
 */
public final class ElementFilter implements Resettable {

    private final Set<String> seen = ConcurrentHashMap.newKeySet();

    /** @return 새로 등록된 시그니처 수 */
    public int registerNew(Collection<String> signatures) {
        if (signatures == null) return 0;
        int added = 0;
        for (String s : signatures) {
            if (s != null && seen.add(s)) added++;
        }
        return added;
    }

    public boolean contains(String signature) {
        return seen.contains(signature);
    }

    public int size() {
        return seen.size();
    }

    @Override
    public void reset() {
        seen.clear();
    }
}
