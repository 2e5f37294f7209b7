package com.github.blockcache.cache;

/**
 * 缓存条目的不透明句柄，每个句柄占用条目的一个引用计数
 * 每次成功的 insert/lookup 都必须对应且仅对应一次 release
 */
public interface Handle<V> {
}
