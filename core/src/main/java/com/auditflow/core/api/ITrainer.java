package com.auditflow.core.api;

/**
 * 응답 관찰자. 새 상태(폼/링크)를 발견하면 오케스트레이터 페이지 큐에 밀어 넣는다.
 * reset 마다 새로 만들어지며, close() 로 트랜스포트 리스너를 해제한다.
 */
public interface ITrainer extends AutoCloseable {

    /** 트랜스포트 reset 으로 리스너가 지워졌을 때 다시 붙는다 */
    default void reattach() {}

    @Override
    void close();
}
