package latchkey.storage.mongo;

import com.mongodb.MongoException;

import java.util.Arrays;

/** <a href="https://www.mongodb.com/docs/manual/reference/error-codes/">MongoDB Error Code</a> */
enum MongoErrorCode {
  UNKNOWN_ERROR(8),
  HOST_UNREACHABLE(6),
  HOST_NOT_FOUND(7),
  LOCK_TIMEOUT(24),
  LOCK_BUSY(46),
  NETWORK_TIMEOUT(89),
  WRITE_CONFLICT(112),
  PRIMARY_STEPPED_DOWN(189),
  NOT_WRITABLE_PRIMARY(10107),
  DUPLICATE_KEY(11000),
  ;

  private final int code;

  MongoErrorCode(int code) {
    this.code = code;
  }

  static MongoErrorCode fromException(MongoException error) {
    return Arrays.stream(MongoErrorCode.values())
        .filter(t -> t.code == error.getCode())
        .findFirst()
        .orElse(MongoErrorCode.UNKNOWN_ERROR);
  }

  boolean isTransient() {
    return switch (this) {
      case HOST_UNREACHABLE, HOST_NOT_FOUND, LOCK_TIMEOUT, LOCK_BUSY, NETWORK_TIMEOUT,
          WRITE_CONFLICT, PRIMARY_STEPPED_DOWN, NOT_WRITABLE_PRIMARY -> true;
      default -> false;
    };
  }
}
