package org.flatline;

import org.flatline.annotations.Flatten;
import org.flatline.annotations.NoFlatten;
import org.objectweb.asm.Type;
import org.objectweb.asm.tree.AnnotationNode;
import org.objectweb.asm.tree.ClassNode;
import org.objectweb.asm.tree.MethodNode;

public class ClassMethodFilter {

    private static final String FLATTEN_ANNOTATION_DESC = Type.getDescriptor(Flatten.class);
    private static final String NO_FLATTEN_ANNOTATION_DESC = Type.getDescriptor(NoFlatten.class);

    private final ClassMethodList blackList;
    private final ClassMethodList whiteList;
    private final boolean useAnnotations;

    /**
     * @param whiteList {@code null} to allow every class
     */
    public ClassMethodFilter(ClassMethodList blackList, ClassMethodList whiteList, boolean useAnnotations) {
        this.blackList = blackList;
        this.whiteList = whiteList;
        this.useAnnotations = useAnnotations;
    }

    public static String nameOf(ClassNode classNode, MethodNode methodNode) {
        return classNode.name + '#' + methodNode.name + '!' + methodNode.desc;
    }

    private boolean hasInList(ClassMethodList list, String name) {
        if (list == null) {
            return false;
        }
        return list.contains(name);
    }

    private static boolean hasAnnotation(Iterable<AnnotationNode> annotations, String desc) {
        if (annotations == null) {
            return false;
        }
        for (AnnotationNode annotationNode : annotations) {
            if (annotationNode.desc.equals(desc)) {
                return true;
            }
        }
        return false;
    }

    public boolean shouldProcess(ClassNode classNode) {
        if (hasInList(blackList, classNode.name)) {
            return false;
        }
        if (!useAnnotations) {
            return whiteList == null || hasInList(whiteList, classNode.name)
                    || classNode.methods.stream().anyMatch(m -> hasInList(whiteList, nameOf(classNode, m)));
        }
        if (whiteList != null && !hasInList(whiteList, classNode.name)) {
            return false;
        }
        if (hasAnnotation(classNode.invisibleAnnotations, NO_FLATTEN_ANNOTATION_DESC)) {
            return false;
        }
        if (hasAnnotation(classNode.invisibleAnnotations, FLATTEN_ANNOTATION_DESC)) {
            return true;
        }
        return classNode.methods.stream().anyMatch(methodNode -> shouldProcess(classNode, methodNode));
    }

    public boolean shouldProcess(ClassNode classNode, MethodNode methodNode) {
        String name = nameOf(classNode, methodNode);
        if (hasInList(blackList, classNode.name) || hasInList(blackList, name)) {
            return false;
        }
        if (whiteList != null && !hasInList(whiteList, classNode.name) && !hasInList(whiteList, name)) {
            return false;
        }
        if (!useAnnotations) {
            return true;
        }
        if (hasAnnotation(classNode.invisibleAnnotations, NO_FLATTEN_ANNOTATION_DESC)) {
            return false;
        }
        if (hasAnnotation(methodNode.invisibleAnnotations, NO_FLATTEN_ANNOTATION_DESC)) {
            return false;
        }
        if (hasAnnotation(methodNode.invisibleAnnotations, FLATTEN_ANNOTATION_DESC)) {
            return true;
        }
        return hasAnnotation(classNode.invisibleAnnotations, FLATTEN_ANNOTATION_DESC);
    }

    /** Removes the marker annotations; they have no meaning in the output. */
    public static void cleanAnnotations(ClassNode classNode) {
        if (classNode.invisibleAnnotations != null) {
            classNode.invisibleAnnotations.removeIf(annotationNode ->
                    annotationNode.desc.equals(FLATTEN_ANNOTATION_DESC) || annotationNode.desc.equals(NO_FLATTEN_ANNOTATION_DESC));
        }
        classNode.methods.stream()
                .filter(methodNode -> methodNode.invisibleAnnotations != null)
                .forEach(methodNode -> methodNode.invisibleAnnotations.removeIf(annotationNode ->
                        annotationNode.desc.equals(FLATTEN_ANNOTATION_DESC) || annotationNode.desc.equals(NO_FLATTEN_ANNOTATION_DESC)));
    }
}
