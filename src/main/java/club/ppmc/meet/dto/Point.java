package club.ppmc.meet.dto;

/**
 * 画布坐标点。使用包装类型，以便区分缺失字段与零值。
 */
public record Point(Double x, Double y) {

    public static Point of(double x, double y) {
        return new Point(x, y);
    }
}
