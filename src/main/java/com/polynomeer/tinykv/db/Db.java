package com.polynomeer.tinykv.db;

import com.polynomeer.tinykv.resp.RespValue;

import java.util.List;
import java.util.Map;

/**
 * Flat key space shared by every connection.
 * Each call is atomic with respect to every other call; there is no multi-call transaction.
 */
public interface Db {

    /**
     * Stored value, or null if the key is absent.
     */
    RespValue get(Key key);

    /**
     * Unconditional upsert.
     */
    void set(Key key, RespValue value);

    /**
     * Remove key; returns true if it existed.
     */
    boolean delete(Key key);

    /**
     * Remove every entry; returns how many there were.
     */
    int flush();

    /**
     * One lookup per key in request order, null for each missing key.
     */
    List<RespValue> mget(List<Key> keys);

    /**
     * Apply pairs left to right (a later duplicate key wins); returns the number of pairs applied.
     */
    int mset(List<Map.Entry<Key, RespValue>> pairs);

    int size();
}
