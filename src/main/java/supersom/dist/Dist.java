package supersom.dist;

public interface Dist<T> {
	public double dist(T a, T b);
}
