package org.muma.rudis.common;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

/**
 * Redis List 封装类 (双端队列)
 * <p>
 * 下标语义与 Redis 一致：负数从尾部计数，-1 为最后一个元素。
 */
public class RedisList {

    private final LinkedList<String> items = new LinkedList<>();

    /**
     * 头部插入 (LPUSH)
     */
    public void lpush(String element) {
        items.addFirst(element);
    }

    /**
     * 尾部插入 (RPUSH)
     */
    public void rpush(String element) {
        items.addLast(element);
    }

    public String lpop() {
        return items.pollFirst();
    }

    public String rpop() {
        return items.pollLast();
    }

    public int size() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    /**
     * 范围查询 (LRANGE)，start/stop 闭区间
     */
    public List<String> range(long start, long stop) {
        int size = items.size();
        long from = normalize(start, size);
        long to = stop < 0 ? size + stop : stop;
        if (from < 0) from = 0;
        if (to >= size) to = size - 1;
        if (from > to || from >= size) {
            return new ArrayList<>();
        }
        return new ArrayList<>(items.subList((int) from, (int) to + 1));
    }

    /**
     * 获取指定索引元素 (LINDEX)，越界返回 null
     */
    public String index(long index) {
        long i = normalize(index, items.size());
        if (i < 0 || i >= items.size()) {
            return null;
        }
        return items.get((int) i);
    }

    /**
     * 设置指定索引元素 (LSET)
     *
     * @throws IllegalArgumentException 下标越界
     */
    public void set(long index, String element) {
        long i = normalize(index, items.size());
        if (i < 0 || i >= items.size()) {
            throw new IllegalArgumentException("index out of range");
        }
        items.set((int) i, element);
    }

    /**
     * LREM 语义：count > 0 从头删，count < 0 从尾删，count == 0 全删
     *
     * @return 实际删除的个数
     */
    public int remove(long count, String element) {
        long limit = count == 0 ? Long.MAX_VALUE : Math.abs(count);
        int removed = 0;
        if (count >= 0) {
            Iterator<String> it = items.iterator();
            while (it.hasNext() && removed < limit) {
                if (it.next().equals(element)) {
                    it.remove();
                    removed++;
                }
            }
        } else {
            ListIterator<String> it = items.listIterator(items.size());
            while (it.hasPrevious() && removed < limit) {
                if (it.previous().equals(element)) {
                    it.remove();
                    removed++;
                }
            }
        }
        return removed;
    }

    /**
     * LTRIM：只保留 [start, stop] 区间
     */
    public void trim(long start, long stop) {
        List<String> kept = range(start, stop);
        items.clear();
        items.addAll(kept);
    }

    /**
     * 合并另一个列表 (追加到尾部，RDB 加载时的合并语义)
     */
    public void addAll(RedisList other) {
        items.addAll(other.items);
    }

    public List<String> toList() {
        return new ArrayList<>(items);
    }

    private static long normalize(long index, int size) {
        return index < 0 ? size + index : index;
    }
}
