package org.muma.rudis.protocol;

import lombok.Getter;

@Getter
public class RespException extends RuntimeException {

    private final RespError error;

    public RespException(RespError error, String message) {
        super(error + ": " + message);
        this.error = error;
    }

    public static RespException noMoreData() {
        return new RespException(RespError.NO_MORE_DATA, "incomplete frame");
    }
}
