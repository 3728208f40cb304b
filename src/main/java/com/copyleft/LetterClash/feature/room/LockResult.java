package com.copyleft.LetterClash.feature.room;

import lombok.Getter;

@Getter
public class LockResult<T> {
    private final T data;
    private final Status status;

    public enum Status {
        SUCCESS,      // 성공
        LOCK_FAILED,  // 락 획득 실패
        ROOM_CLOSED,  // 락을 기다리는 사이 방이 삭제됨
        NOT_IN_ROOM   // 세션이 어떤 방에도 속해 있지 않음
    }

    private LockResult(T data, Status status) {
        this.data = data;
        this.status = status;
    }

    public static <T> LockResult<T> success(T data) {
        return new LockResult<>(data, Status.SUCCESS);
    }

    public static <T> LockResult<T> lockFailed() {
        return new LockResult<>(null, Status.LOCK_FAILED);
    }

    public static <T> LockResult<T> roomClosed() {
        return new LockResult<>(null, Status.ROOM_CLOSED);
    }

    public static <T> LockResult<T> notInRoom() {
        return new LockResult<>(null, Status.NOT_IN_ROOM);
    }

    public boolean isLockFailed() { return status == Status.LOCK_FAILED; }
    public boolean isRoomClosed() { return status == Status.ROOM_CLOSED; }
    public boolean isNotInRoom() { return status == Status.NOT_IN_ROOM; }
    public boolean isSuccess() { return status == Status.SUCCESS; }
}
