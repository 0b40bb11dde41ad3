package latchkey.storage.mongo;

public interface LatchkeyCollectionNamespace {

  String KEY_NAMESPACE = "latchkey_keys";
}
