package club.ppmc.meet.model;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 房间成员集合，保持加入顺序。非线程安全，所有访问都由`RoomRegistry`的锁保护。
 */
public class Room {

    private final String id;
    private final Set<String> memberIds = new LinkedHashSet<>();

    public Room(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean add(String connectionId) {
        return memberIds.add(connectionId);
    }

    public boolean remove(String connectionId) {
        return memberIds.remove(connectionId);
    }

    public boolean contains(String connectionId) {
        return memberIds.contains(connectionId);
    }

    public boolean isEmpty() {
        return memberIds.isEmpty();
    }

    public int size() {
        return memberIds.size();
    }

    /**
     * @return 当前成员ID的副本，按加入顺序排列。
     */
    public List<String> memberIds() {
        return new ArrayList<>(memberIds);
    }
}
